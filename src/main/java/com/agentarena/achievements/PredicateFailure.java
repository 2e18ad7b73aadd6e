package com.agentarena.achievements;

/** A rule that threw during evaluation. Only that rule is skipped for the pass. */
public record PredicateFailure(String capabilityName, String achievementKey, String message) {}
