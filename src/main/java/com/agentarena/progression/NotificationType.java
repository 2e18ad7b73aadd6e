package com.agentarena.progression;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationType {
    XP_GAINED("xp_gained"),
    LEVEL_UP("level_up"),
    ACHIEVEMENT_UNLOCKED("achievement_unlocked");

    private final String wireName;

    NotificationType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
