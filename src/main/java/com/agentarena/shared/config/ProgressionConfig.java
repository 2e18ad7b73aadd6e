package com.agentarena.shared.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Level thresholds (total XP at which each level starts, level 1 first) and tier names
 * keyed to the first level of the tier.
 */
public record ProgressionConfig(List<Long> levelThresholds, Map<String, Integer> tiers) {

    public static final int DEFAULT_LEVELS = 20;

    public ProgressionConfig {
        levelThresholds = List.copyOf(levelThresholds);
        tiers = Collections.unmodifiableMap(new LinkedHashMap<>(tiers));
    }

    public static ProgressionConfig defaults() {
        return new ProgressionConfig(defaultThresholds(), defaultTiers());
    }

    /** 0, 100, 300, 600, 1000, ... : level n starts at 50 * n * (n - 1). */
    public static List<Long> defaultThresholds() {
        var thresholds = new ArrayList<Long>();
        for (long n = 1; n <= DEFAULT_LEVELS; n++) {
            thresholds.add(50 * n * (n - 1));
        }
        return thresholds;
    }

    public static Map<String, Integer> defaultTiers() {
        var tiers = new LinkedHashMap<String, Integer>();
        tiers.put("Novice", 1);
        tiers.put("Adept", 5);
        tiers.put("Expert", 9);
        tiers.put("Master", 13);
        tiers.put("Grandmaster", 17);
        tiers.put("Legend", 20);
        return tiers;
    }
}
