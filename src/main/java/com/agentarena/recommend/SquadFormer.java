package com.agentarena.recommend;

import com.agentarena.shared.config.RecommendationConfig;
import com.agentarena.shared.model.Category;
import com.agentarena.shared.model.ProjectSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;

/**
 * Picks a bounded, category-diverse squad from ranked capabilities.
 *
 * <p>Target size is {@code complexity + 1} clamped to {@code [minSize, maxSize]}. No more than
 * {@code maxPerCategory} members share a category unless the candidates span fewer than
 * {@code minSize} categories. If the cap leaves the squad short of the target, the best skipped
 * candidates fill the remaining slots in rank order.
 */
public class SquadFormer {

    private static final Logger log = LoggerFactory.getLogger(SquadFormer.class);

    private final RecommendationConfig.SquadConfig config;
    private final List<RecommendationConfig.Synergy> synergies;

    public SquadFormer(RecommendationConfig.SquadConfig config, List<RecommendationConfig.Synergy> synergies) {
        this.config = config;
        this.synergies = List.copyOf(synergies);
    }

    public SquadFormation formSquad(ProjectSignature signature, List<ScoredCapability> ranked) {
        return formSquad(signature, ranked, config.minSize(), config.maxSize());
    }

    public SquadFormation formSquad(ProjectSignature signature, List<ScoredCapability> ranked, int minSize, int maxSize) {
        if (minSize < 1 || maxSize < minSize) {
            throw new IllegalArgumentException("Squad size bounds invalid: min=" + minSize + " max=" + maxSize);
        }
        if (ranked.isEmpty()) {
            return SquadFormation.empty(signature);
        }
        if (ranked.size() < minSize) {
            log.info("Only {} capabilities registered, squad is undersized (min {})", ranked.size(), minSize);
            return build(signature, ranked, true);
        }

        int target = Math.max(minSize, Math.min(maxSize, signature.complexity() + 1));
        int distinctCategories = (int) ranked.stream().map(s -> s.descriptor().category()).distinct().count();
        boolean enforceDiversity = distinctCategories >= minSize;

        var selected = new ArrayList<ScoredCapability>();
        var skipped = new ArrayList<ScoredCapability>();
        var perCategory = new EnumMap<Category, Integer>(Category.class);
        for (var candidate : ranked) {
            if (selected.size() == target) break;
            var category = candidate.descriptor().category();
            int used = perCategory.getOrDefault(category, 0);
            if (enforceDiversity && used >= config.maxPerCategory()) {
                skipped.add(candidate);
                continue;
            }
            selected.add(candidate);
            perCategory.put(category, used + 1);
        }
        for (var candidate : skipped) {
            if (selected.size() == target) break;
            selected.add(candidate);
        }
        selected.sort(RecommendationEngine.RANKING);
        return build(signature, selected, selected.size() < minSize);
    }

    private SquadFormation build(ProjectSignature signature, List<ScoredCapability> picked, boolean undersized) {
        var members = new ArrayList<SquadMember>();
        for (int i = 0; i < picked.size(); i++) {
            var s = picked.get(i);
            var role = i == 0 ? SquadRole.LEAD : SquadRole.forCategory(s.descriptor().category());
            members.add(new SquadMember(s.descriptor(), s.score(), role));
        }

        var names = new HashSet<String>();
        members.forEach(m -> names.add(m.name()));
        var matched = synergies.stream().filter(s -> names.containsAll(s.members())).toList();
        int bonus = Math.min(config.synergyCapPercent(),
            matched.stream().mapToInt(RecommendationConfig.Synergy::bonusPercent).sum());
        return new SquadFormation(signature, members, bonus, matched, undersized);
    }
}
