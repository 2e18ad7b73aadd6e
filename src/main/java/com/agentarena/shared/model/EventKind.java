package com.agentarena.shared.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EventKind {
    /** A reported invocation of the capability. */
    USAGE,
    /** Bonus XP appended when an achievement unlocks. */
    ACHIEVEMENT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
