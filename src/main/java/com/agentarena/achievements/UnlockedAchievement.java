package com.agentarena.achievements;

import com.agentarena.shared.model.XpEvent;

public record UnlockedAchievement(String capabilityName, String key, String title, int xpReward, XpEvent event) {}
