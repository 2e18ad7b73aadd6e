package com.agentarena.registry;

import java.util.List;

/**
 * A registry index together with the per-file problems met while building it.
 */
public record DiscoveryResult(RegistryIndex index, List<ParseFailure> warnings) {
    public DiscoveryResult {
        warnings = List.copyOf(warnings);
    }
}
