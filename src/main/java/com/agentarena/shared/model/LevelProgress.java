package com.agentarena.shared.model;

public record LevelProgress(
    int level,
    String tier,
    long totalXp,
    long xpIntoLevel,
    long xpToNextLevel,
    double progressPercent,
    boolean maxLevel
) {}
