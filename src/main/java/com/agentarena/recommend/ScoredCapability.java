package com.agentarena.recommend;

import com.agentarena.shared.model.CapabilityDescriptor;

/**
 * @param difficultyMatch whether the descriptor's difficulty suits the request's complexity;
 *                        breaks ties between equal scores and levels
 */
public record ScoredCapability(CapabilityDescriptor descriptor, double score, int level, boolean difficultyMatch) {

    public String name() {
        return descriptor.name();
    }
}
