package com.agentarena.progression;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Pattern;

public enum TaskComplexity {
    SIMPLE(1.0, Duration.ofSeconds(30)),
    MEDIUM(1.5, Duration.ofMinutes(2)),
    COMPLEX(2.0, Duration.ofMinutes(5)),
    EXPERT(3.0, Duration.ofMinutes(10));

    private static final Pattern EXPERT_WORDS =
        Pattern.compile("\\b(architect\\w*|distributed|migrat\\w*|redesign\\w*|security audit|optimi[sz]\\w*)\\b");
    private static final Pattern COMPLEX_WORDS =
        Pattern.compile("\\b(implement\\w*|integrat\\w*|refactor\\w*|debug\\w*|build\\w*|design\\w*)\\b");
    private static final Pattern SIMPLE_WORDS =
        Pattern.compile("\\b(typo|rename\\w*|format\\w*|lint\\w*|bump\\w*|comment\\w*|readme)\\b");

    private final double multiplier;
    private final Duration expectedDuration;

    TaskComplexity(double multiplier, Duration expectedDuration) {
        this.multiplier = multiplier;
        this.expectedDuration = expectedDuration;
    }

    public double multiplier() {
        return multiplier;
    }

    public Duration expectedDuration() {
        return expectedDuration;
    }

    /** Best-effort guess from a task label; MEDIUM when nothing matches. */
    public static TaskComplexity infer(String taskLabel) {
        if (taskLabel == null || taskLabel.isBlank()) return MEDIUM;
        var text = taskLabel.toLowerCase(Locale.ROOT);
        if (EXPERT_WORDS.matcher(text).find()) return EXPERT;
        if (COMPLEX_WORDS.matcher(text).find()) return COMPLEX;
        if (SIMPLE_WORDS.matcher(text).find()) return SIMPLE;
        return MEDIUM;
    }

    public static TaskComplexity fromName(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
