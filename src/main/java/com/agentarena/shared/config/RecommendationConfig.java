package com.agentarena.shared.config;

import java.util.List;

public record RecommendationConfig(
    Weights weights,
    SquadConfig squad,
    List<Synergy> synergies
) {
    /** Scoring weights; tech-stack overlap must dominate category affinity, which dominates history. */
    public record Weights(double tech, double category, double history) {
        public Weights {
            if (!(tech > category && category > history && history >= 0)) {
                throw new IllegalArgumentException(
                    "Scoring weights must satisfy tech > category > history >= 0, got tech=" + tech
                        + " category=" + category + " history=" + history);
            }
        }

        public static Weights defaults() {
            return new Weights(0.6, 0.3, 0.1);
        }
    }

    public record SquadConfig(int minSize, int maxSize, int maxPerCategory, int synergyCapPercent) {
        public SquadConfig {
            if (minSize < 1 || maxSize < minSize) {
                throw new IllegalArgumentException("Squad size bounds invalid: min=" + minSize + " max=" + maxSize);
            }
            if (maxPerCategory < 1) {
                throw new IllegalArgumentException("max-per-category must be >= 1, got " + maxPerCategory);
            }
        }

        public static SquadConfig defaults() {
            return new SquadConfig(3, 6, 2, 30);
        }
    }

    /** A known-good combination: when every member is in a squad, its bonus applies. */
    public record Synergy(List<String> members, int bonusPercent) {
        public Synergy {
            members = List.copyOf(members);
            if (members.size() < 2) {
                throw new IllegalArgumentException("A synergy needs at least two members: " + members);
            }
            if (bonusPercent < 0) {
                throw new IllegalArgumentException("Synergy bonus must be >= 0 for " + members);
            }
        }
    }

    public static List<Synergy> defaultSynergies() {
        return List.of(
            new Synergy(List.of("backend-architect", "frontend-developer"), 15),
            new Synergy(List.of("backend-architect", "security-auditor"), 10),
            new Synergy(List.of("data-engineer", "python-elite"), 10),
            new Synergy(List.of("devops-engineer", "cloud-architect"), 10),
            new Synergy(List.of("test-engineer", "full-stack-architect"), 5)
        );
    }

    public static RecommendationConfig defaults() {
        return new RecommendationConfig(Weights.defaults(), SquadConfig.defaults(), defaultSynergies());
    }
}
