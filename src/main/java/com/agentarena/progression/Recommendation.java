package com.agentarena.progression;

import com.agentarena.recommend.ScoredCapability;
import com.agentarena.recommend.SquadFormation;
import com.agentarena.recommend.WorkEstimate;
import com.agentarena.shared.model.ProjectSignature;

import java.util.List;

public record Recommendation(String request, ProjectSignature signature, List<ScoredCapability> ranked,
                             SquadFormation squad, WorkEstimate estimate) {
    public Recommendation {
        ranked = List.copyOf(ranked);
    }
}
