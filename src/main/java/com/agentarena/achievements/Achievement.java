package com.agentarena.achievements;

public record Achievement(String key, String title, String description, int xpReward,
                          AchievementPredicate predicate) {
    public Achievement {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Achievement key is required");
        }
        if (xpReward < 0) {
            throw new IllegalArgumentException("xpReward must be >= 0 for achievement '" + key + "'");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("predicate is required for achievement '" + key + "'");
        }
    }
}
