package com.agentarena.recommend;

import com.agentarena.shared.model.CapabilityDescriptor;

public record SquadMember(CapabilityDescriptor descriptor, double matchScore, SquadRole role) {

    public String name() {
        return descriptor.name();
    }
}
