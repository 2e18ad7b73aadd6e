package com.agentarena.progression;

import com.agentarena.achievements.AchievementEngine;
import com.agentarena.classify.KeywordTechStackClassifier;
import com.agentarena.ledger.JsonFileLedgerStore;
import com.agentarena.ledger.LedgerStore;
import com.agentarena.ledger.LedgerVerification;
import com.agentarena.ledger.LevelTable;
import com.agentarena.ledger.ProgressCalculator;
import com.agentarena.ledger.XpLedger;
import com.agentarena.observability.MetricsConfig;
import com.agentarena.recommend.CapabilityStanding;
import com.agentarena.recommend.RecommendationEngine;
import com.agentarena.recommend.ScoredCapability;
import com.agentarena.recommend.SignatureInferrer;
import com.agentarena.recommend.SquadFormation;
import com.agentarena.recommend.SquadFormer;
import com.agentarena.recommend.WorkEstimator;
import com.agentarena.registry.CapabilityRegistry;
import com.agentarena.registry.DescriptorLoader;
import com.agentarena.registry.DiscoveryResult;
import com.agentarena.registry.SearchFilter;
import com.agentarena.shared.config.ArenaConfig;
import com.agentarena.shared.config.RecommendationConfig;
import com.agentarena.shared.model.AgentProgress;
import com.agentarena.shared.model.CapabilityDescriptor;
import com.agentarena.shared.model.LeaderboardEntry;
import com.agentarena.shared.model.LevelProgress;
import com.agentarena.shared.model.Outcome;
import com.agentarena.shared.model.ProjectSignature;
import com.agentarena.shared.model.XpEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Single entry point for callers: discovery, search and recommendation on the registry side,
 * event recording and progress queries on the ledger side.
 */
public class ProgressionFacade implements CapabilityStanding.Lookup {

    private static final Logger log = LoggerFactory.getLogger(ProgressionFacade.class);

    private static final Comparator<AgentProgress> LEADERBOARD_ORDER = Comparator
        .comparingLong(AgentProgress::totalXp).reversed()
        .thenComparing(AgentProgress::firstEventAt, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(AgentProgress::capabilityName);

    private final CapabilityRegistry registry;
    private final SignatureInferrer inferrer;
    private final RecommendationEngine engine;
    private final SquadFormer squadFormer;
    private final WorkEstimator estimator = new WorkEstimator();
    private final XpLedger ledger;
    private final AchievementEngine achievements;
    private final MetricsConfig metrics;
    private final Clock clock;
    private final List<ProgressionListener> listeners = new CopyOnWriteArrayList<>();

    public ProgressionFacade(CapabilityRegistry registry, SignatureInferrer inferrer,
                             RecommendationConfig recommendation, XpLedger ledger,
                             AchievementEngine achievements, MetricsConfig metrics, Clock clock) {
        this.registry = registry;
        this.inferrer = inferrer;
        this.engine = new RecommendationEngine(recommendation.weights(), this);
        this.squadFormer = new SquadFormer(recommendation.squad(), recommendation.synergies());
        this.ledger = ledger;
        this.achievements = achievements;
        this.metrics = metrics;
        this.clock = clock;
    }

    /** Wires the default components from a loaded configuration, persisting to the configured ledger file. */
    public static ProgressionFacade create(ArenaConfig config, MetricsConfig metrics) {
        var calculator = new ProgressCalculator(LevelTable.from(config.progression()));
        return create(config, metrics, new JsonFileLedgerStore(config.ledgerFile(), calculator), calculator);
    }

    public static ProgressionFacade create(ArenaConfig config, MetricsConfig metrics,
                                           LedgerStore store, ProgressCalculator calculator) {
        var classifier = new KeywordTechStackClassifier();
        var registry = new CapabilityRegistry(config.searchRoots(), config.cacheTtl(),
            new DescriptorLoader(classifier), Clock.systemUTC(), metrics);
        var ledger = new XpLedger(store, calculator, registry::hasEverSeen);
        return new ProgressionFacade(registry, new SignatureInferrer(classifier), config.recommendation(),
            ledger, new AchievementEngine(ledger, metrics), metrics, Clock.systemUTC());
    }

    public void addListener(ProgressionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ProgressionListener listener) {
        listeners.remove(listener);
    }

    public CapabilityRegistry registry() {
        return registry;
    }

    public XpLedger ledger() {
        return ledger;
    }

    public AchievementEngine achievements() {
        return achievements;
    }

    // --- registry side ---

    public DiscoveryResult discover() {
        return registry.discover();
    }

    public DiscoveryResult discover(boolean forceRefresh) {
        return registry.discover(forceRefresh);
    }

    public List<CapabilityDescriptor> search(SearchFilter filter) {
        return registry.discover().index().search(filter);
    }

    public ProjectSignature inferSignature(String request) {
        return inferrer.inferSignature(request);
    }

    public Recommendation recommend(String request) {
        return recommend(request, Integer.MAX_VALUE);
    }

    public Recommendation recommend(String request, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        }
        var signature = inferrer.inferSignature(request);
        var ranked = rankAll(signature);
        var squad = squadFormer.formSquad(signature, ranked);
        var shown = ranked.size() > limit ? ranked.subList(0, limit) : ranked;
        return new Recommendation(request, signature, shown, squad, estimator.estimate(signature));
    }

    public SquadFormation formSquad(ProjectSignature signature) {
        return squadFormer.formSquad(signature, rankAll(signature));
    }

    public SquadFormation formSquad(ProjectSignature signature, int minSize, int maxSize) {
        return squadFormer.formSquad(signature, rankAll(signature), minSize, maxSize);
    }

    @Override
    public CapabilityStanding standingOf(String capabilityName) {
        var events = ledger.history(capabilityName);
        return events.isEmpty() ? CapabilityStanding.NONE : standing(ledger.fold(capabilityName, events));
    }

    /** Ranks every registered capability against one read of the ledger. */
    private List<ScoredCapability> rankAll(ProjectSignature signature) {
        var byName = new HashMap<String, List<XpEvent>>();
        for (var e : ledger.store().readAll()) {
            byName.computeIfAbsent(e.capabilityName(), k -> new ArrayList<>()).add(e);
        }
        Map<String, CapabilityStanding> standings = new HashMap<>();
        byName.forEach((name, events) -> standings.put(name, standing(ledger.fold(name, events))));
        return engine.rank(registry.discover().index().all(), signature,
            name -> standings.getOrDefault(name, CapabilityStanding.NONE));
    }

    private static CapabilityStanding standing(AgentProgress p) {
        return new CapabilityStanding(p.level(), p.successRate(), true);
    }

    // --- ledger side ---

    public RecordResult recordEvent(String capabilityName, String taskLabel, Outcome outcome, int baseXp) {
        return recordEvent(capabilityName, taskLabel, outcome, baseXp, null);
    }

    /**
     * Appends a usage event, runs one achievement pass and notifies listeners.
     *
     * @throws com.agentarena.ledger.UnknownCapabilityException if the name was never discovered
     *         and has no history
     * @throws com.agentarena.ledger.CorruptLedgerException if the ledger is refusing writes
     */
    public RecordResult recordEvent(String capabilityName, String taskLabel, Outcome outcome, int baseXp,
                                    Long durationMillis) {
        XpLedger.requireName(capabilityName);
        registry.discover();
        int previousLevel = ledger.isKnown(capabilityName) ? ledger.getProgress(capabilityName).level() : 1;

        var event = ledger.recordEvent(capabilityName, taskLabel, outcome, baseXp, durationMillis);
        metrics.eventsRecorded().increment();
        var evaluation = achievements.evaluate(capabilityName);
        var progress = ledger.getProgress(capabilityName);

        var now = clock.instant();
        notifyListeners(ProgressionNotification.xpGained(capabilityName, now, progress.totalXp(),
            progress.level(), progress.tier(), event.totalXp()));
        for (var a : evaluation.unlocked()) {
            notifyListeners(ProgressionNotification.achievementUnlocked(capabilityName, now, progress.totalXp(),
                progress.level(), progress.tier(), a.key(), a.title(), a.xpReward()));
        }
        if (progress.level() > previousLevel) {
            log.info("{} reached level {} ({})", capabilityName, progress.level(), progress.tier());
            notifyListeners(ProgressionNotification.levelUp(capabilityName, now, progress.totalXp(),
                progress.level(), progress.tier(), previousLevel));
        }
        return new RecordResult(event, progress, previousLevel, evaluation.unlocked(), evaluation.failures());
    }

    public AgentProgress getProgress(String capabilityName) {
        XpLedger.requireName(capabilityName);
        return ledger.getProgress(capabilityName);
    }

    public LevelProgress levelProgress(String capabilityName) {
        XpLedger.requireName(capabilityName);
        return ledger.levels().progress(ledger.getProgress(capabilityName).totalXp());
    }

    public List<XpEvent> history(String capabilityName) {
        return ledger.history(capabilityName);
    }

    /** Top {@code topN} capabilities by total XP; equal XP ranks the earliest first event higher. */
    public List<LeaderboardEntry> leaderboard(int topN) {
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be >= 1, got " + topN);
        }
        var ordered = ledger.trackedCapabilities().stream()
            .map(ledger::getProgress)
            .sorted(LEADERBOARD_ORDER)
            .limit(topN)
            .toList();
        var entries = new ArrayList<LeaderboardEntry>();
        for (int i = 0; i < ordered.size(); i++) {
            var p = ordered.get(i);
            entries.add(new LeaderboardEntry(i + 1, p.capabilityName(), p.totalXp(), p.level(), p.tier(),
                p.successCount(), p.unlockedAchievements().size()));
        }
        return entries;
    }

    public LedgerVerification verifyLedger() {
        return ledger.store().verify();
    }

    public LedgerVerification rebuildLedger() {
        return ledger.store().rebuild();
    }

    private void notifyListeners(ProgressionNotification notification) {
        for (var listener : listeners) {
            try {
                listener.onNotification(notification);
            } catch (RuntimeException e) {
                log.warn("Progression listener {} failed on {}: {}", listener, notification.type(), e.toString());
            }
        }
    }
}
