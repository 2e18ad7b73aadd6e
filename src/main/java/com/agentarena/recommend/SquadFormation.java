package com.agentarena.recommend;

import com.agentarena.shared.config.RecommendationConfig;
import com.agentarena.shared.model.ProjectSignature;

import java.util.List;

/**
 * Ranked squad for one signature. {@code synergyBonusPercent} only affects {@link #aggregateScore()},
 * never XP.
 */
public record SquadFormation(
    ProjectSignature signature,
    List<SquadMember> members,
    int synergyBonusPercent,
    List<RecommendationConfig.Synergy> matchedSynergies,
    boolean undersized
) {
    public SquadFormation {
        members = List.copyOf(members);
        matchedSynergies = List.copyOf(matchedSynergies);
    }

    public static SquadFormation empty(ProjectSignature signature) {
        return new SquadFormation(signature, List.of(), 0, List.of(), true);
    }

    public double baseScore() {
        return members.stream().mapToDouble(SquadMember::matchScore).sum();
    }

    public double aggregateScore() {
        return baseScore() * (1 + synergyBonusPercent / 100.0);
    }

    public List<String> memberNames() {
        return members.stream().map(SquadMember::name).toList();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }
}
