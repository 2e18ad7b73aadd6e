package com.agentarena.channels;

import com.agentarena.ledger.CorruptLedgerException;
import com.agentarena.ledger.UnknownCapabilityException;
import com.agentarena.observability.DoctorCommand;
import com.agentarena.progression.ProgressionFacade;
import com.agentarena.progression.XpPolicy;
import com.agentarena.registry.SearchFilter;
import com.agentarena.shared.model.Category;
import com.agentarena.shared.model.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Slash commands typed into the CLI. Every command returns the text to print.
 */
public class ArenaCommands {

    private static final Logger log = LoggerFactory.getLogger(ArenaCommands.class);

    static final String HELP = String.join("\n",
        "/discover [--refresh]                      scan search roots",
        "/search [category=c,..] [tech=t,..] [min=n] [max=n] [text]",
        "/recommend <task description>              ranked capabilities and a squad",
        "/log <name> <success|failure> [xp=n] [time=secs] [label]",
        "/progress <name>                           level, XP and achievements",
        "/leaderboard [n]                           top capabilities by XP",
        "/verify                                    check ledger consistency",
        "/rebuild                                   recompute ledger summaries",
        "/registry                                  search roots and category counts",
        "/doctor                                    environment checks",
        "/quit");

    private final ProgressionFacade facade;
    private final DoctorCommand doctor;
    private final XpPolicy xpPolicy;

    public ArenaCommands(ProgressionFacade facade, DoctorCommand doctor, XpPolicy xpPolicy) {
        this.facade = facade;
        this.doctor = doctor;
        this.xpPolicy = xpPolicy;
    }

    public String handle(String input) {
        var trimmed = input.trim();
        int space = trimmed.indexOf(' ');
        var command = (space < 0 ? trimmed : trimmed.substring(0, space)).toLowerCase(Locale.ROOT);
        var args = space < 0 ? "" : trimmed.substring(space + 1).trim();
        try {
            return switch (command) {
                case "/discover" -> discover(args);
                case "/search" -> search(args);
                case "/recommend" -> recommend(args);
                case "/log" -> logEvent(args);
                case "/progress" -> progress(args);
                case "/leaderboard" -> leaderboard(args);
                case "/verify" -> facade.verifyLedger().describe();
                case "/rebuild" -> facade.rebuildLedger().describe();
                case "/registry" -> registry();
                case "/doctor" -> doctor.run();
                case "/help" -> HELP;
                default -> "Unknown command: " + command + " (try /help)";
            };
        } catch (UnknownCapabilityException | CorruptLedgerException | IllegalArgumentException e) {
            log.debug("Command {} rejected: {}", command, e.getMessage());
            return "Error: " + e.getMessage();
        }
    }

    private String discover(String args) {
        var result = facade.discover("--refresh".equals(args));
        var sb = new StringBuilder("Discovered " + result.index().size() + " capabilities");
        if (!result.warnings().isEmpty()) {
            sb.append(" (").append(result.warnings().size()).append(" warnings)");
            result.warnings().forEach(w -> sb.append("\n  ").append(w));
        }
        return sb.toString();
    }

    private String search(String args) {
        var filter = SearchFilter.all();
        var text = new ArrayList<String>();
        Integer min = null;
        Integer max = null;
        for (var token : args.split("\\s+")) {
            if (token.isEmpty()) continue;
            if (token.startsWith("category=")) {
                var categories = EnumSet.noneOf(Category.class);
                for (var raw : token.substring(9).split(",")) {
                    var c = Category.fromName(raw);
                    if (c == null) throw new IllegalArgumentException("Unknown category: " + raw);
                    categories.add(c);
                }
                filter = filter.withCategories(categories);
            } else if (token.startsWith("tech=")) {
                filter = filter.withTechStack(new HashSet<>(List.of(token.substring(5).split(","))));
            } else if (token.startsWith("min=")) {
                min = parseInt("min", token.substring(4));
            } else if (token.startsWith("max=")) {
                max = parseInt("max", token.substring(4));
            } else {
                text.add(token);
            }
        }
        filter = filter.withComplexity(min, max).withQuery(String.join(" ", text));
        var found = facade.search(filter);
        if (found.isEmpty()) return "No capabilities match.";
        return found.stream()
            .map(d -> String.format("%-28s %-15s %s", d.name(), d.category().id(), d.summary()))
            .collect(Collectors.joining("\n"));
    }

    private String recommend(String args) {
        if (args.isEmpty()) throw new IllegalArgumentException("Usage: /recommend <task description>");
        var rec = facade.recommend(args, 10);
        var sig = rec.signature();
        var sb = new StringBuilder();
        sb.append("Signature: ").append(sig.projectType().id())
            .append(", complexity ").append(sig.complexity())
            .append(", tech ").append(sig.inferredTechStack()).append('\n');
        if (rec.ranked().isEmpty()) {
            return sb.append("No capabilities registered.").toString();
        }
        for (var s : rec.ranked()) {
            sb.append(String.format("  %.3f  %-28s L%d%n", s.score(), s.name(), s.level()));
        }
        var squad = rec.squad();
        sb.append("Squad").append(squad.undersized() ? " (undersized)" : "").append(':');
        for (var m : squad.members()) {
            sb.append("\n  ").append(m.role()).append("  ").append(m.name());
        }
        if (squad.synergyBonusPercent() > 0) {
            sb.append("\nSynergy bonus: +").append(squad.synergyBonusPercent()).append('%');
        }
        var estimate = rec.estimate();
        sb.append("\nEstimated effort: ").append(estimate.estimatedHours()).append(" hours");
        estimate.taskBreakdown().forEach(t -> sb.append("\n  - ").append(t));
        return sb.toString();
    }

    private String logEvent(String args) {
        var parts = args.split("\\s+");
        if (parts.length < 2 || parts[0].isEmpty()) {
            throw new IllegalArgumentException("Usage: /log <name> <success|failure> [xp=n] [time=secs] [label]");
        }
        var name = parts[0];
        var outcome = Outcome.parse(parts[1]);
        Integer xp = null;
        Duration taken = null;
        var label = new ArrayList<String>();
        for (int i = 2; i < parts.length; i++) {
            if (parts[i].startsWith("xp=")) xp = parseInt("xp", parts[i].substring(3));
            else if (parts[i].startsWith("time=")) taken = Duration.ofSeconds(parseInt("time", parts[i].substring(5)));
            else label.add(parts[i]);
        }
        var taskLabel = String.join(" ", label);
        int baseXp = xp != null ? xp
            : xpPolicy.baseXp(taskLabel, outcome, taken, currentStreak(name));
        var result = facade.recordEvent(name, taskLabel, outcome, baseXp, taken == null ? null : taken.toMillis());

        var p = result.progress();
        var sb = new StringBuilder(String.format("%s +%d XP -> %d XP, level %d (%s)",
            name, result.event().totalXp(), p.totalXp(), p.level(), p.tier()));
        if (result.leveledUp()) sb.append("\nLEVEL UP: ").append(result.previousLevel()).append(" -> ").append(p.level());
        result.unlocked().forEach(a -> sb.append("\nAchievement unlocked: ").append(a.title())
            .append(" (+").append(a.xpReward()).append(" XP)"));
        result.warnings().forEach(w -> sb.append("\nWarning: rule ").append(w.achievementKey())
            .append(" failed: ").append(w.message()));
        return sb.toString();
    }

    private String progress(String args) {
        if (args.isEmpty()) throw new IllegalArgumentException("Usage: /progress <name>");
        var p = facade.getProgress(args);
        var lp = facade.levelProgress(args);
        return String.format("%s: level %d %s, %d XP (%.1f%% to next, %d needed)%n"
                + "uses %d, successes %d, failures %d, streak %d (best %d)%nachievements: %s",
            p.capabilityName(), p.level(), p.tier(), p.totalXp(), lp.progressPercent(), lp.xpToNextLevel(),
            p.eventCount(), p.successCount(), p.failureCount(), p.currentStreak(), p.longestStreak(),
            p.unlockedAchievements().isEmpty() ? "none" : String.join(", ", p.unlockedAchievements()));
    }

    private String leaderboard(String args) {
        int n = args.isEmpty() ? 10 : parseInt("n", args);
        var entries = facade.leaderboard(n);
        if (entries.isEmpty()) return "No recorded activity yet.";
        return entries.stream()
            .map(e -> String.format("%2d. %-28s %6d XP  L%-2d %s", e.rank(), e.capabilityName(),
                e.totalXp(), e.level(), e.tier()))
            .collect(Collectors.joining("\n"));
    }

    private String registry() {
        var index = facade.discover().index();
        var sb = new StringBuilder("Search roots (lowest priority first):");
        facade.registry().roots().forEach(r -> sb.append("\n  ").append(r));
        sb.append("\nCapabilities: ").append(index.size());
        index.categoryCounts().forEach((c, count) -> sb.append("\n  ").append(c.id()).append(": ").append(count));
        return sb.toString();
    }

    private int currentStreak(String name) {
        var history = facade.history(name);
        return history.isEmpty() ? 0 : facade.getProgress(name).currentStreak();
    }

    private static int parseInt(String what, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + what + ": '" + raw + "'");
        }
    }
}
