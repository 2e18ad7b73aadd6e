package com.agentarena.shared.model;

import java.time.Instant;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Derived view of one capability's event stream. Always recomputable from the events alone.
 */
public record AgentProgress(
    String capabilityName,
    long totalXp,
    int level,
    String tier,
    int eventCount,
    int successCount,
    int failureCount,
    int currentStreak,
    int longestStreak,
    SortedSet<String> unlockedAchievements,
    Instant firstEventAt,
    Instant lastEventAt
) {
    public AgentProgress {
        unlockedAchievements = Collections.unmodifiableSortedSet(new TreeSet<>(unlockedAchievements));
    }

    public double successRate() {
        return eventCount == 0 ? 0.0 : (double) successCount / eventCount;
    }

    public boolean hasHistory() {
        return firstEventAt != null;
    }
}
