package com.agentarena.registry;

import com.agentarena.shared.model.CapabilityDescriptor;

/**
 * Either a parsed descriptor or the reason the file was rejected.
 */
public record LoadResult(CapabilityDescriptor descriptor, ParseFailure failure) {

    public static LoadResult ok(CapabilityDescriptor descriptor) {
        return new LoadResult(descriptor, null);
    }

    public static LoadResult failed(ParseFailure failure) {
        return new LoadResult(null, failure);
    }

    public boolean isOk() {
        return descriptor != null;
    }
}
