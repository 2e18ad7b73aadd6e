package com.agentarena.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Immutable ledger entry. The store assigns {@code eventId}; nothing ever rewrites one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record XpEvent(
    long eventId,
    String capabilityName,
    Instant timestamp,
    String taskLabel,
    Outcome outcome,
    int baseXp,
    int bonusXp,
    EventKind kind,
    String achievementKey,
    Long durationMillis
) {
    public XpEvent {
        if (baseXp < 0 || bonusXp < 0) {
            throw new IllegalArgumentException("XP values must be non-negative (event " + eventId
                + ", capability '" + capabilityName + "')");
        }
        if (kind == null) kind = EventKind.USAGE;
    }

    @JsonIgnore
    public long totalXp() {
        return (long) baseXp + bonusXp;
    }

    @JsonIgnore
    public boolean isUsage() {
        return kind == EventKind.USAGE;
    }
}
