package com.agentarena.achievements;

import com.agentarena.shared.model.AgentProgress;
import com.agentarena.shared.model.XpEvent;

import java.util.List;

/**
 * Unlock rule. Must be a pure function of the fresh progress and the full event history.
 */
@FunctionalInterface
public interface AchievementPredicate {
    boolean test(AgentProgress progress, List<XpEvent> history);
}
