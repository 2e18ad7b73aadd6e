package com.agentarena.progression;

import com.agentarena.shared.model.Outcome;

import java.time.Duration;

/**
 * Caller-side base XP calculation. The ledger itself only sums what it is given; this is how the
 * CLI and HTTP surfaces derive a base value when the caller does not supply one.
 *
 * <pre>
 *   xp = round(BASE_XP * complexity * speed * streak * (failure ? 0.3 : 1.0))
 * </pre>
 */
public class XpPolicy {

    public static final int BASE_XP = 10;
    static final double FAILURE_MODIFIER = 0.3;

    public int baseXp(TaskComplexity complexity, Outcome outcome, Duration taken, int successStreak) {
        double multiplier = complexity.multiplier()
            * speedMultiplier(complexity, taken)
            * streakMultiplier(successStreak)
            * (outcome == Outcome.SUCCESS ? 1.0 : FAILURE_MODIFIER);
        return (int) Math.round(BASE_XP * multiplier);
    }

    public int baseXp(String taskLabel, Outcome outcome, Duration taken, int successStreak) {
        return baseXp(TaskComplexity.infer(taskLabel), outcome, taken, successStreak);
    }

    static double speedMultiplier(TaskComplexity complexity, Duration taken) {
        if (taken == null || taken.isZero() || taken.isNegative()) return 1.0;
        double expected = complexity.expectedDuration().toMillis();
        double actual = taken.toMillis();
        if (actual <= expected * 0.5) return 1.5;
        if (actual <= expected * 0.75) return 1.25;
        if (actual <= expected) return 1.0;
        return Math.max(0.8, 1.0 - (actual - expected) / expected * 0.2);
    }

    static double streakMultiplier(int successStreak) {
        if (successStreak >= 30) return 2.0;
        if (successStreak >= 14) return 1.5;
        if (successStreak >= 7) return 1.3;
        if (successStreak >= 3) return 1.1;
        return 1.0;
    }
}
