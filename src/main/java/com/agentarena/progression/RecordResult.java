package com.agentarena.progression;

import com.agentarena.achievements.PredicateFailure;
import com.agentarena.achievements.UnlockedAchievement;
import com.agentarena.shared.model.AgentProgress;
import com.agentarena.shared.model.XpEvent;

import java.util.List;

/**
 * Outcome of one usage event: the appended event, progress after any achievement bonuses,
 * and what changed.
 */
public record RecordResult(
    XpEvent event,
    AgentProgress progress,
    int previousLevel,
    List<UnlockedAchievement> unlocked,
    List<PredicateFailure> warnings
) {
    public RecordResult {
        unlocked = List.copyOf(unlocked);
        warnings = List.copyOf(warnings);
    }

    public boolean leveledUp() {
        return progress.level() > previousLevel;
    }
}
