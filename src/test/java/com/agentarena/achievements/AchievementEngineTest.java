package com.agentarena.achievements;

import com.agentarena.ledger.InMemoryLedgerStore;
import com.agentarena.ledger.LevelTable;
import com.agentarena.ledger.ProgressCalculator;
import com.agentarena.ledger.XpLedger;
import com.agentarena.observability.MetricsConfig;
import com.agentarena.shared.model.EventKind;
import com.agentarena.shared.model.Outcome;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AchievementEngineTest {

    private static final Achievement FIRST_SUCCESS = new Achievement("first-success", "First Blood",
            "Complete a task successfully", 50, (p, h) -> p.successCount() >= 1);

    private final MetricsConfig metrics = new MetricsConfig();
    private final XpLedger ledger = new XpLedger(new InMemoryLedgerStore(),
            new ProgressCalculator(LevelTable.defaults()), name -> true);

    @Test
    void firstSuccessUnlocksAndAddsBonus() {
        var engine = new AchievementEngine(ledger, List.of(FIRST_SUCCESS), metrics);
        ledger.recordEvent("alpha", "task", Outcome.SUCCESS, 10);

        var evaluation = engine.evaluate("alpha");

        assertEquals(1, evaluation.unlocked().size());
        var unlocked = evaluation.unlocked().get(0);
        assertEquals("first-success", unlocked.key());
        assertEquals(EventKind.ACHIEVEMENT, unlocked.event().kind());
        assertEquals("achievement:first-success", unlocked.event().taskLabel());
        assertEquals(50, unlocked.event().bonusXp());

        var progress = ledger.getProgress("alpha");
        assertEquals(60, progress.totalXp());
        assertEquals(Set.of("first-success"), progress.unlockedAchievements());
        assertEquals(1.0, metrics.achievementsUnlocked().count());
    }

    @Test
    void unlocksExactlyOnce() {
        var engine = new AchievementEngine(ledger, List.of(FIRST_SUCCESS), metrics);
        ledger.recordEvent("alpha", "task", Outcome.SUCCESS, 10);
        engine.evaluate("alpha");
        ledger.recordEvent("alpha", "task", Outcome.SUCCESS, 10);

        assertTrue(engine.evaluate("alpha").unlocked().isEmpty());
        assertTrue(engine.evaluate("alpha").unlocked().isEmpty());
        assertEquals(1, ledger.history("alpha").stream().filter(e -> e.kind() == EventKind.ACHIEVEMENT).count());
    }

    @Test
    void failureDoesNotUnlockFirstSuccess() {
        var engine = new AchievementEngine(ledger, List.of(FIRST_SUCCESS), metrics);
        ledger.recordEvent("alpha", "task", Outcome.FAILURE, 3);
        assertEquals(AchievementEvaluation.none(), engine.evaluate("alpha"));
    }

    @Test
    void throwingRuleIsIsolated() {
        var broken = new Achievement("broken", "Broken", "always throws", 10, (p, h) -> {
            throw new IllegalStateException("boom");
        });
        var engine = new AchievementEngine(ledger, List.of(broken, FIRST_SUCCESS), metrics);
        ledger.recordEvent("alpha", "task", Outcome.SUCCESS, 10);

        var evaluation = engine.evaluate("alpha");

        assertEquals(1, evaluation.failures().size());
        assertEquals("broken", evaluation.failures().get(0).achievementKey());
        assertTrue(evaluation.failures().get(0).message().contains("boom"));
        assertEquals(List.of("first-success"), evaluation.unlocked().stream().map(UnlockedAchievement::key).toList());
        assertEquals(1.0, metrics.predicateFailures().count());
    }

    @Test
    void bonusXpIsNotReEvaluatedInTheSamePass() {
        var engine = new AchievementEngine(ledger, metrics);
        ledger.recordEvent("alpha", "big task", Outcome.SUCCESS, 250);

        var first = engine.evaluate("alpha");
        assertEquals(List.of("first-success"), first.unlocked().stream().map(UnlockedAchievement::key).toList());
        assertEquals(3, ledger.getProgress("alpha").level());
        assertFalse(ledger.getProgress("alpha").unlockedAchievements().contains("expert"));

        ledger.recordEvent("alpha", "small task", Outcome.SUCCESS, 1);
        var second = engine.evaluate("alpha");
        assertEquals(List.of("expert"), second.unlocked().stream().map(UnlockedAchievement::key).toList());
        assertEquals(100, second.bonusXp());
    }

    @Test
    void rejectsDuplicateKeys() {
        assertThrows(IllegalArgumentException.class,
                () -> new AchievementEngine(ledger, List.of(FIRST_SUCCESS, FIRST_SUCCESS), metrics));
    }

    @Test
    void streakRuleUsesLongestStreak() {
        var engine = new AchievementEngine(ledger, metrics);
        for (int i = 0; i < 5; i++) {
            ledger.recordEvent("alpha", "task", Outcome.SUCCESS, 1);
        }
        ledger.recordEvent("alpha", "task", Outcome.FAILURE, 1);
        var keys = engine.evaluate("alpha").unlocked().stream().map(UnlockedAchievement::key).toList();
        assertTrue(keys.contains("hot-streak"));
        assertFalse(keys.contains("ten-missions"));
    }
}
