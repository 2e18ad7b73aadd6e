package com.agentarena.gateway.http;

import com.agentarena.ledger.LedgerVerification;
import com.agentarena.progression.ProgressionFacade;
import com.agentarena.progression.Recommendation;
import com.agentarena.progression.RecordResult;
import com.agentarena.progression.TaskComplexity;
import com.agentarena.progression.XpPolicy;
import com.agentarena.registry.SearchFilter;
import com.agentarena.shared.model.AgentProgress;
import com.agentarena.shared.model.CapabilityDescriptor;
import com.agentarena.shared.model.Category;
import com.agentarena.shared.model.LeaderboardEntry;
import com.agentarena.shared.model.LevelProgress;
import com.agentarena.shared.model.Outcome;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@RestController
public class ArenaController {

    private final ProgressionFacade facade;
    private final XpPolicy xpPolicy;

    public ArenaController(ProgressionFacade facade, XpPolicy xpPolicy) {
        this.facade = facade;
        this.xpPolicy = xpPolicy;
    }

    @GetMapping("/v1/capabilities")
    public List<CapabilityDescriptor> capabilities(@RequestParam(required = false) List<String> category,
                                                   @RequestParam(required = false) Set<String> tech,
                                                   @RequestParam(required = false) Integer minComplexity,
                                                   @RequestParam(required = false) Integer maxComplexity,
                                                   @RequestParam(required = false) String q) {
        var categories = EnumSet.noneOf(Category.class);
        if (category != null) {
            for (var raw : category) {
                var c = Category.fromName(raw);
                if (c == null) throw new IllegalArgumentException("Unknown category: " + raw);
                categories.add(c);
            }
        }
        return facade.search(new SearchFilter(categories, tech, minComplexity, maxComplexity, q));
    }

    @PostMapping("/v1/recommend")
    public Recommendation recommend(@RequestBody RecommendRequest body) {
        if (body.request() == null || body.request().isBlank()) {
            throw new IllegalArgumentException("request is required");
        }
        return facade.recommend(body.request(), body.limit() == null ? 10 : body.limit());
    }

    @PostMapping("/v1/events")
    public RecordResult recordEvent(@RequestBody EventRequest body) {
        var outcome = Outcome.parse(body.outcome());
        var taken = body.durationMillis() == null ? null : Duration.ofMillis(body.durationMillis());
        int baseXp;
        if (body.baseXp() != null) {
            baseXp = body.baseXp();
        } else {
            var complexity = body.complexity() != null
                ? TaskComplexity.fromName(body.complexity())
                : TaskComplexity.infer(body.taskLabel());
            int streak = facade.history(body.capabilityName()).isEmpty()
                ? 0 : facade.getProgress(body.capabilityName()).currentStreak();
            baseXp = xpPolicy.baseXp(complexity, outcome, taken, streak);
        }
        return facade.recordEvent(body.capabilityName(), body.taskLabel(), outcome, baseXp, body.durationMillis());
    }

    @GetMapping("/v1/progress/{name}")
    public ProgressView progress(@PathVariable String name) {
        return new ProgressView(facade.getProgress(name), facade.levelProgress(name));
    }

    @GetMapping("/v1/leaderboard")
    public List<LeaderboardEntry> leaderboard(@RequestParam(defaultValue = "10") int top) {
        return facade.leaderboard(top);
    }

    @PostMapping("/v1/ledger/verify")
    public LedgerVerification verify() {
        return facade.verifyLedger();
    }

    @PostMapping("/v1/ledger/rebuild")
    public LedgerVerification rebuild() {
        return facade.rebuildLedger();
    }

    public record RecommendRequest(String request, Integer limit) {}

    public record EventRequest(String capabilityName, String taskLabel, String outcome, Integer baseXp,
                               Long durationMillis, String complexity) {}

    public record ProgressView(AgentProgress progress, LevelProgress levelProgress) {}
}
