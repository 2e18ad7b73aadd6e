package com.agentarena.achievements;

import java.util.List;

public record AchievementEvaluation(List<UnlockedAchievement> unlocked, List<PredicateFailure> failures) {
    public AchievementEvaluation {
        unlocked = List.copyOf(unlocked);
        failures = List.copyOf(failures);
    }

    public static AchievementEvaluation none() {
        return new AchievementEvaluation(List.of(), List.of());
    }

    public int bonusXp() {
        return unlocked.stream().mapToInt(UnlockedAchievement::xpReward).sum();
    }
}
