package com.agentarena.achievements;

import com.agentarena.shared.model.Outcome;
import com.agentarena.shared.model.XpEvent;

import java.util.List;

/**
 * Built-in achievement catalogue.
 */
public final class DefaultAchievements {

    static final long SPEED_LIMIT_MILLIS = 60_000;

    private DefaultAchievements() {}

    public static List<Achievement> catalogue() {
        return List.of(
            new Achievement("first-success", "First Blood", "Complete a task successfully", 50,
                (p, h) -> p.successCount() >= 1),
            new Achievement("hot-streak", "Hot Streak", "5 successes in a row", 100,
                (p, h) -> p.longestStreak() >= 5),
            new Achievement("ten-missions", "Veteran", "Take part in 10 tasks", 100,
                (p, h) -> p.eventCount() >= 10),
            new Achievement("centurion", "Centurion", "Take part in 100 tasks", 250,
                (p, h) -> p.eventCount() >= 100),
            new Achievement("speed-demon", "Speed Demon", "5 successes finished in under a minute", 100,
                (p, h) -> fastSuccesses(h) >= 5),
            new Achievement("comeback", "Comeback", "Succeed right after 3 or more failures in a row", 75,
                (p, h) -> hasComeback(h)),
            new Achievement("perfectionist", "Perfectionist", "20 successes without a single failure", 150,
                (p, h) -> p.successCount() >= 20 && p.failureCount() == 0),
            new Achievement("expert", "Expert", "Reach level 3", 100,
                (p, h) -> p.level() >= 3),
            new Achievement("elite", "Elite", "Reach level 5", 200,
                (p, h) -> p.level() >= 5)
        );
    }

    static long fastSuccesses(List<XpEvent> history) {
        return history.stream()
            .filter(XpEvent::isUsage)
            .filter(e -> e.outcome() == Outcome.SUCCESS)
            .filter(e -> e.durationMillis() != null && e.durationMillis() < SPEED_LIMIT_MILLIS)
            .count();
    }

    static boolean hasComeback(List<XpEvent> history) {
        int failuresInARow = 0;
        for (var e : history) {
            if (!e.isUsage()) continue;
            if (e.outcome() == Outcome.FAILURE) {
                failuresInARow++;
            } else {
                if (failuresInARow >= 3) return true;
                failuresInARow = 0;
            }
        }
        return false;
    }
}
