package com.agentarena.shared.model;

import java.util.Locale;

public enum Difficulty {
    BEGINNER(1),
    INTERMEDIATE(3),
    ADVANCED(4),
    EXPERT(5);

    private final int complexity;

    Difficulty(int complexity) {
        this.complexity = complexity;
    }

    /** Complexity on the 1-5 scale shared with {@link ProjectSignature}. */
    public int complexity() { return complexity; }

    public static Difficulty fromName(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
