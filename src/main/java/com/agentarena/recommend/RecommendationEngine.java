package com.agentarena.recommend;

import com.agentarena.shared.config.RecommendationConfig;
import com.agentarena.shared.model.CapabilityDescriptor;
import com.agentarena.shared.model.ProjectSignature;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Scores capabilities against a {@link ProjectSignature}:
 * <pre>
 *   score = techOverlap * W_TECH + categoryAffinity * W_CATEGORY + historicalSuccessRate * W_HISTORY
 * </pre>
 * Ranking breaks equal scores by higher level, then by a difficulty that suits the request's
 * complexity, then by name.
 */
public class RecommendationEngine {

    /** Success rate assumed for a capability with no recorded history. */
    static final double NEUTRAL_SUCCESS_RATE = 0.5;

    static final Comparator<ScoredCapability> RANKING = Comparator
        .comparingDouble(ScoredCapability::score).reversed()
        .thenComparing(Comparator.comparingInt(ScoredCapability::level).reversed())
        .thenComparing(ScoredCapability::difficultyMatch, Comparator.reverseOrder())
        .thenComparing(ScoredCapability::name);

    private final RecommendationConfig.Weights weights;
    private final CapabilityStanding.Lookup standings;

    public RecommendationEngine(RecommendationConfig.Weights weights, CapabilityStanding.Lookup standings) {
        this.weights = weights;
        this.standings = standings;
    }

    public double score(CapabilityDescriptor capability, ProjectSignature signature) {
        return score(capability, signature, standings.standingOf(capability.name()));
    }

    private double score(CapabilityDescriptor capability, ProjectSignature signature, CapabilityStanding standing) {
        var history = standing.hasHistory() ? standing.successRate() : NEUTRAL_SUCCESS_RATE;
        return techOverlap(capability, signature) * weights.tech()
            + CategoryAffinity.of(capability.category(), signature.projectType()) * weights.category()
            + history * weights.history();
    }

    /** Fraction of the signature's tags the capability carries; 0 when the signature has none. */
    static double techOverlap(CapabilityDescriptor capability, ProjectSignature signature) {
        var wanted = signature.inferredTechStack();
        if (wanted.isEmpty()) return 0.0;
        long shared = wanted.stream().filter(capability.techStackTags()::contains).count();
        return (double) shared / wanted.size();
    }

    public List<ScoredCapability> rank(Collection<CapabilityDescriptor> capabilities, ProjectSignature signature) {
        return rank(capabilities, signature, standings);
    }

    /** Ranks against a caller-supplied standing lookup, typically one snapshot of the ledger. */
    public List<ScoredCapability> rank(Collection<CapabilityDescriptor> capabilities, ProjectSignature signature,
                                       CapabilityStanding.Lookup lookup) {
        return capabilities.stream()
            .map(c -> {
                var standing = lookup.standingOf(c.name());
                return new ScoredCapability(c, score(c, signature, standing), standing.level(),
                    DifficultyFit.matches(c.difficulty(), signature.complexity()));
            })
            .sorted(RANKING)
            .toList();
    }
}
