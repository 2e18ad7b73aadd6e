package com.agentarena.achievements;

import com.agentarena.ledger.XpLedger;
import com.agentarena.observability.MetricsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the still-locked rules for a capability once per usage event. Progress and history are
 * read once at the start of the pass; bonus events appended during the pass are not re-evaluated.
 */
public class AchievementEngine {

    private static final Logger log = LoggerFactory.getLogger(AchievementEngine.class);

    private final XpLedger ledger;
    private final Map<String, Achievement> catalogue = new LinkedHashMap<>();
    private final MetricsConfig metrics;

    public AchievementEngine(XpLedger ledger, List<Achievement> catalogue, MetricsConfig metrics) {
        this.ledger = ledger;
        this.metrics = metrics;
        for (var a : catalogue) {
            if (this.catalogue.putIfAbsent(a.key(), a) != null) {
                throw new IllegalArgumentException("Duplicate achievement key: " + a.key());
            }
        }
    }

    public AchievementEngine(XpLedger ledger, MetricsConfig metrics) {
        this(ledger, DefaultAchievements.catalogue(), metrics);
    }

    public List<Achievement> catalogue() {
        return List.copyOf(catalogue.values());
    }

    public AchievementEvaluation evaluate(String capabilityName) {
        var progress = ledger.getProgress(capabilityName);
        var history = ledger.history(capabilityName);

        var qualified = new ArrayList<Achievement>();
        var failures = new ArrayList<PredicateFailure>();
        for (var achievement : catalogue.values()) {
            if (progress.unlockedAchievements().contains(achievement.key())) continue;
            try {
                if (achievement.predicate().test(progress, history)) {
                    qualified.add(achievement);
                }
            } catch (RuntimeException e) {
                log.warn("Achievement rule '{}' failed for {}: {}", achievement.key(), capabilityName, e.toString());
                metrics.predicateFailures().increment();
                failures.add(new PredicateFailure(capabilityName, achievement.key(), e.toString()));
            }
        }

        var unlocked = new ArrayList<UnlockedAchievement>();
        for (var achievement : qualified) {
            var event = ledger.recordAchievement(capabilityName, achievement.key(), achievement.xpReward());
            if (event == null) continue;
            metrics.achievementsUnlocked().increment();
            log.info("{} unlocked '{}' (+{} XP)", capabilityName, achievement.title(), achievement.xpReward());
            unlocked.add(new UnlockedAchievement(capabilityName, achievement.key(), achievement.title(),
                achievement.xpReward(), event));
        }
        return new AchievementEvaluation(unlocked, failures);
    }
}
