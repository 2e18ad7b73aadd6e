package com.agentarena.progression;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dashboard message: {@code {type, capabilityName, payload, timestamp}}. The payload always carries
 * the capability's {@code totalXp}, {@code level} and {@code tier} after the change, plus the
 * fields specific to the type.
 */
public record ProgressionNotification(
    NotificationType type,
    String capabilityName,
    Map<String, Object> payload,
    Instant timestamp
) {
    public ProgressionNotification {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    static ProgressionNotification xpGained(String name, Instant at, long totalXp, int level, String tier, long gained) {
        var payload = standing(totalXp, level, tier);
        payload.put("xpGained", gained);
        return new ProgressionNotification(NotificationType.XP_GAINED, name, payload, at);
    }

    static ProgressionNotification levelUp(String name, Instant at, long totalXp, int level, String tier, int previous) {
        var payload = standing(totalXp, level, tier);
        payload.put("previousLevel", previous);
        return new ProgressionNotification(NotificationType.LEVEL_UP, name, payload, at);
    }

    static ProgressionNotification achievementUnlocked(String name, Instant at, long totalXp, int level, String tier,
                                                       String key, String title, int reward) {
        var payload = standing(totalXp, level, tier);
        payload.put("achievementKey", key);
        payload.put("achievementTitle", title);
        payload.put("xpReward", reward);
        return new ProgressionNotification(NotificationType.ACHIEVEMENT_UNLOCKED, name, payload, at);
    }

    private static Map<String, Object> standing(long totalXp, int level, String tier) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("totalXp", totalXp);
        payload.put("level", level);
        payload.put("tier", tier);
        return payload;
    }
}
