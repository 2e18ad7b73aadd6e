package com.agentarena.shared.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One discovered specialist file: structured header fields plus the opaque body.
 * {@code name} is the registry key; {@code sourceRoot} records where it was found.
 */
public record CapabilityDescriptor(
    String name,
    String summary,
    Category category,
    Set<String> techStackTags,
    Path sourceRoot,
    Path sourceFile,
    String color,
    String tools,
    Difficulty difficulty,
    List<String> specialties,
    Map<String, Object> extensions,
    String rawBody
) {
    public CapabilityDescriptor {
        techStackTags = Set.copyOf(techStackTags);
        specialties = List.copyOf(specialties);
        extensions = Map.copyOf(extensions);
    }

    public int complexity() {
        return difficulty.complexity();
    }
}
