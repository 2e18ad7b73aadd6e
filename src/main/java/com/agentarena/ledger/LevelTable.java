package com.agentarena.ledger;

import com.agentarena.shared.config.ProgressionConfig;
import com.agentarena.shared.model.LevelProgress;

import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Step function from total XP to level. {@code thresholds[i]} is the XP at which level {@code i + 1}
 * starts; XP exactly on a threshold belongs to the higher level.
 */
public class LevelTable {

    private final long[] thresholds;
    private final NavigableMap<Integer, String> tiers = new TreeMap<>();

    public LevelTable(List<Long> thresholds, Map<String, Integer> tiers) {
        if (thresholds.isEmpty() || thresholds.get(0) != 0L) {
            throw new IllegalArgumentException("Level thresholds must start at 0, got " + thresholds);
        }
        this.thresholds = new long[thresholds.size()];
        for (int i = 0; i < thresholds.size(); i++) {
            long t = thresholds.get(i);
            if (i > 0 && t <= this.thresholds[i - 1]) {
                throw new IllegalArgumentException("Level thresholds must strictly increase: "
                    + this.thresholds[i - 1] + " then " + t + " at level " + (i + 1));
            }
            this.thresholds[i] = t;
        }
        tiers.forEach((name, firstLevel) -> {
            if (firstLevel < 1) {
                throw new IllegalArgumentException("Tier '" + name + "' must start at level >= 1, got " + firstLevel);
            }
            this.tiers.put(firstLevel, name);
        });
        if (!this.tiers.isEmpty() && this.tiers.firstKey() != 1) {
            throw new IllegalArgumentException("The first tier must start at level 1, got " + this.tiers.firstKey());
        }
    }

    public static LevelTable from(ProgressionConfig config) {
        return new LevelTable(config.levelThresholds(), config.tiers());
    }

    public static LevelTable defaults() {
        return from(ProgressionConfig.defaults());
    }

    public int level(long totalXp) {
        int lo = 0;
        int hi = thresholds.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (thresholds[mid] <= totalXp) lo = mid;
            else hi = mid - 1;
        }
        return lo + 1;
    }

    public String tier(int level) {
        var entry = tiers.floorEntry(level);
        return entry == null ? "" : entry.getValue();
    }

    public int maxLevel() {
        return thresholds.length;
    }

    /** XP at which {@code level} starts. */
    public long threshold(int level) {
        if (level < 1 || level > thresholds.length) {
            throw new IllegalArgumentException("No level " + level + " (max " + thresholds.length + ")");
        }
        return thresholds[level - 1];
    }

    public LevelProgress progress(long totalXp) {
        int level = level(totalXp);
        var tier = tier(level);
        if (level == maxLevel()) {
            return new LevelProgress(level, tier, totalXp, totalXp - threshold(level), 0, 100.0, true);
        }
        long start = threshold(level);
        long next = threshold(level + 1);
        long into = totalXp - start;
        double percent = Math.round(into * 1000.0 / (next - start)) / 10.0;
        return new LevelProgress(level, tier, totalXp, into, next - totalXp, percent, false);
    }
}
