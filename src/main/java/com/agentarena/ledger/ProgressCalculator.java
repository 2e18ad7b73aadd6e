package com.agentarena.ledger;

import com.agentarena.shared.model.AgentProgress;
import com.agentarena.shared.model.EventKind;
import com.agentarena.shared.model.Outcome;
import com.agentarena.shared.model.XpEvent;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Folds an event stream into {@link AgentProgress}. Events are processed in {@code eventId} order
 * whatever order they arrive in, so the same events always give the same result.
 */
public class ProgressCalculator {

    private final LevelTable levels;

    public ProgressCalculator(LevelTable levels) {
        this.levels = levels;
    }

    public LevelTable levels() {
        return levels;
    }

    public AgentProgress fold(String capabilityName, List<XpEvent> events) {
        var ordered = events.stream().sorted(Comparator.comparingLong(XpEvent::eventId)).toList();

        long totalXp = 0;
        int uses = 0;
        int successes = 0;
        int failures = 0;
        int streak = 0;
        int longest = 0;
        var unlocked = new TreeSet<String>();
        Instant first = null;
        Instant last = null;

        for (var e : ordered) {
            totalXp += e.totalXp();
            if (first == null) first = e.timestamp();
            last = e.timestamp();
            if (e.kind() == EventKind.ACHIEVEMENT) {
                if (e.achievementKey() != null) unlocked.add(e.achievementKey());
                continue;
            }
            uses++;
            if (e.outcome() == Outcome.SUCCESS) {
                successes++;
                streak++;
                longest = Math.max(longest, streak);
            } else {
                failures++;
                streak = 0;
            }
        }

        int level = levels.level(totalXp);
        return new AgentProgress(capabilityName, totalXp, level, levels.tier(level),
            uses, successes, failures, streak, longest, unlocked, first, last);
    }
}
