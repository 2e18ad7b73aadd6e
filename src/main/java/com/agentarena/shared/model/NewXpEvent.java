package com.agentarena.shared.model;

/**
 * An event as submitted to a ledger store, before it receives an id and timestamp.
 */
public record NewXpEvent(
    String capabilityName,
    String taskLabel,
    Outcome outcome,
    int baseXp,
    int bonusXp,
    EventKind kind,
    String achievementKey,
    Long durationMillis
) {
    public NewXpEvent {
        if (capabilityName == null || capabilityName.isBlank()) {
            throw new IllegalArgumentException("capabilityName is required");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome is required for '" + capabilityName + "'");
        }
        if (baseXp < 0) {
            throw new IllegalArgumentException("baseXp must be >= 0 for '" + capabilityName + "', got " + baseXp);
        }
        if (bonusXp < 0) {
            throw new IllegalArgumentException("bonusXp must be >= 0 for '" + capabilityName + "', got " + bonusXp);
        }
        if (kind == null) kind = EventKind.USAGE;
        if (taskLabel == null) taskLabel = "";
    }

    public static NewXpEvent usage(String capabilityName, String taskLabel, Outcome outcome,
                                   int baseXp, Long durationMillis) {
        return new NewXpEvent(capabilityName, taskLabel, outcome, baseXp, 0, EventKind.USAGE, null, durationMillis);
    }

    public static NewXpEvent achievement(String capabilityName, String achievementKey, int xpReward) {
        return new NewXpEvent(capabilityName, "achievement:" + achievementKey, Outcome.SUCCESS,
            0, xpReward, EventKind.ACHIEVEMENT, achievementKey, null);
    }
}
