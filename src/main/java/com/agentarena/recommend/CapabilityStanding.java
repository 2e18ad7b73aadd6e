package com.agentarena.recommend;

/**
 * What the progression side knows about a capability, as seen by the scorer.
 */
public record CapabilityStanding(int level, double successRate, boolean hasHistory) {

    public static final CapabilityStanding NONE = new CapabilityStanding(1, 0.0, false);

    @FunctionalInterface
    public interface Lookup {
        CapabilityStanding standingOf(String capabilityName);
    }
}
