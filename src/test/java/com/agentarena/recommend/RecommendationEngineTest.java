package com.agentarena.recommend;

import com.agentarena.shared.config.RecommendationConfig;
import com.agentarena.shared.model.Category;
import com.agentarena.shared.model.Difficulty;
import com.agentarena.shared.model.ProjectSignature;
import com.agentarena.shared.model.ProjectType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.agentarena.shared.model.TestDescriptors.descriptor;
import static org.junit.jupiter.api.Assertions.*;

class RecommendationEngineTest {

    private static final RecommendationConfig.Weights WEIGHTS = RecommendationConfig.Weights.defaults();
    private final ProjectSignature apiSignature =
            new ProjectSignature(Set.of("python", "backend", "sql"), ProjectType.API_SERVICE, 2);

    @Test
    void techMatchOutranksNonMatch() {
        var engine = new RecommendationEngine(WEIGHTS, name -> CapabilityStanding.NONE);
        var python = descriptor("python-backend", Category.DEVELOPMENT, "python", "backend");
        var react = descriptor("react-ui", Category.DEVELOPMENT, "react", "frontend");

        var ranked = engine.rank(List.of(react, python), apiSignature);

        assertEquals("python-backend", ranked.get(0).name());
        assertTrue(ranked.get(0).score() > ranked.get(1).score());
        // 2/3 tech overlap, full category affinity, neutral history
        assertEquals(2.0 / 3 * 0.6 + 0.3 + 0.05, ranked.get(0).score(), 1e-9);
        assertEquals(0.3 + 0.05, ranked.get(1).score(), 1e-9);
    }

    @Test
    void historyUsesSuccessRateOnlyWhenPresent() {
        var standings = Map.of(
                "veteran", new CapabilityStanding(4, 1.0, true),
                "flaky", new CapabilityStanding(2, 0.0, true));
        var engine = new RecommendationEngine(WEIGHTS, name -> standings.getOrDefault(name, CapabilityStanding.NONE));
        var sig = new ProjectSignature(Set.of(), ProjectType.GENERIC, 1);

        double veteran = engine.score(descriptor("veteran", Category.DATA), sig);
        double flaky = engine.score(descriptor("flaky", Category.DATA), sig);
        double fresh = engine.score(descriptor("fresh", Category.DATA), sig);

        assertEquals(0.3 * 0.3 + 0.1, veteran, 1e-9);
        assertEquals(0.3 * 0.3, flaky, 1e-9);
        assertEquals(0.3 * 0.3 + 0.05, fresh, 1e-9);
    }

    @Test
    void equalScoresBreakByLevelThenName() {
        var levels = Map.of("b-senior", new CapabilityStanding(5, 0.5, true));
        var engine = new RecommendationEngine(WEIGHTS, name -> levels.getOrDefault(name, CapabilityStanding.NONE));
        var sig = new ProjectSignature(Set.of("python"), ProjectType.GENERIC, 1);

        var ranked = engine.rank(List.of(
                descriptor("c-junior", Category.QUALITY, "python"),
                descriptor("a-junior", Category.QUALITY, "python"),
                descriptor("b-senior", Category.QUALITY, "python")), sig);

        assertEquals(List.of("b-senior", "a-junior", "c-junior"), ranked.stream().map(ScoredCapability::name).toList());
    }

    @Test
    void suitedDifficultyBreaksTiesBeforeName() {
        var engine = new RecommendationEngine(WEIGHTS, name -> CapabilityStanding.NONE);
        var simple = new ProjectSignature(Set.of("python"), ProjectType.GENERIC, 2);
        var hard = new ProjectSignature(Set.of("python"), ProjectType.GENERIC, 5);
        var all = List.of(
                descriptor("a-expert", Category.DEVELOPMENT, Difficulty.EXPERT, "python"),
                descriptor("b-mid", Category.DEVELOPMENT, Difficulty.INTERMEDIATE, "python"));

        var forSimple = engine.rank(all, simple);
        var forHard = engine.rank(all, hard);

        assertEquals(forSimple.get(0).score(), forSimple.get(1).score(), 1e-9);
        assertEquals(List.of("b-mid", "a-expert"), forSimple.stream().map(ScoredCapability::name).toList());
        assertTrue(forSimple.get(0).difficultyMatch());
        assertFalse(forSimple.get(1).difficultyMatch());
        assertEquals(List.of("a-expert", "b-mid"), forHard.stream().map(ScoredCapability::name).toList());
    }

    @Test
    void higherLevelStillWinsOverDifficultyFit() {
        var levels = Map.of("a-expert", new CapabilityStanding(3, 0.5, true));
        var engine = new RecommendationEngine(WEIGHTS, name -> levels.getOrDefault(name, CapabilityStanding.NONE));
        var sig = new ProjectSignature(Set.of(), ProjectType.GENERIC, 1);

        var ranked = engine.rank(List.of(
                descriptor("b-mid", Category.DATA, Difficulty.BEGINNER),
                descriptor("a-expert", Category.DATA, Difficulty.EXPERT)), sig);

        assertEquals("a-expert", ranked.get(0).name());
    }

    @Test
    void techOverlapIsZeroWithoutWantedTags() {
        var sig = new ProjectSignature(Set.of(), ProjectType.GENERIC, 1);
        assertEquals(0.0, RecommendationEngine.techOverlap(descriptor("x", Category.DATA, "python"), sig));
    }

    @Test
    void scoresAreDeterministic() {
        var engine = new RecommendationEngine(WEIGHTS, name -> CapabilityStanding.NONE);
        var all = List.of(descriptor("a", Category.DATA, "python"), descriptor("b", Category.SECURITY, "sql"));
        assertEquals(engine.rank(all, apiSignature), engine.rank(all, apiSignature));
    }
}
