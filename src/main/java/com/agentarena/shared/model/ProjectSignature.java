package com.agentarena.shared.model;

import java.util.Set;

/**
 * Inferred summary of a free-text request. Never persisted.
 */
public record ProjectSignature(Set<String> inferredTechStack, ProjectType projectType, int complexity) {
    public ProjectSignature {
        inferredTechStack = Set.copyOf(inferredTechStack);
        if (complexity < 1 || complexity > 5) {
            throw new IllegalArgumentException("complexity must be in [1, 5], got " + complexity);
        }
    }
}
