package com.agentarena.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Outcome {
    SUCCESS,
    FAILURE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Outcome parse(String raw) {
        if (raw == null) throw new IllegalArgumentException("outcome is required");
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "success", "ok", "pass" -> SUCCESS;
            case "failure", "fail", "error" -> FAILURE;
            default -> throw new IllegalArgumentException("Unknown outcome '" + raw + "' (expected success or failure)");
        };
    }
}
