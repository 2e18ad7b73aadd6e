package com.agentarena.shared.model;

public record LeaderboardEntry(
    int rank,
    String capabilityName,
    long totalXp,
    int level,
    String tier,
    int successCount,
    int achievementCount
) {}
