package com.agentarena.classify;

import java.util.Set;

/**
 * Best-effort mapping from free text to normalized tech-stack tags.
 * Results are heuristic and never authoritative.
 */
@FunctionalInterface
public interface TechStackClassifier {
    Set<String> classify(String text);
}
