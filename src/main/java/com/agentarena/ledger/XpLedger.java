package com.agentarena.ledger;

import com.agentarena.shared.model.AgentProgress;
import com.agentarena.shared.model.NewXpEvent;
import com.agentarena.shared.model.Outcome;
import com.agentarena.shared.model.XpEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Records XP events and derives progress from them. A capability is accepted when the registry
 * has discovered it during this process or the ledger already holds history for it.
 */
public class XpLedger {

    private static final Logger log = LoggerFactory.getLogger(XpLedger.class);

    private final LedgerStore store;
    private final ProgressCalculator calculator;
    private final Predicate<String> discovered;

    public XpLedger(LedgerStore store, ProgressCalculator calculator, Predicate<String> discovered) {
        this.store = store;
        this.calculator = calculator;
        this.discovered = discovered;
    }

    public XpEvent recordEvent(String capabilityName, String taskLabel, Outcome outcome, int baseXp) {
        return recordEvent(capabilityName, taskLabel, outcome, baseXp, null);
    }

    public XpEvent recordEvent(String capabilityName, String taskLabel, Outcome outcome, int baseXp,
                               Long durationMillis) {
        requireName(capabilityName);
        var pending = NewXpEvent.usage(capabilityName, taskLabel, outcome, baseXp, durationMillis);
        requireKnown(capabilityName);
        var event = store.append(pending);
        log.debug("Recorded event {} for {}: {} {} XP", event.eventId(), capabilityName, outcome, baseXp);
        return event;
    }

    /**
     * Appends the bonus event for an achievement unless one with the same key already exists.
     *
     * @return the new event, or {@code null} when the achievement was already unlocked
     */
    public XpEvent recordAchievement(String capabilityName, String achievementKey, int xpReward) {
        requireName(capabilityName);
        var pending = NewXpEvent.achievement(capabilityName, achievementKey, xpReward);
        requireKnown(capabilityName);
        return store.appendIfAbsent(pending);
    }

    public AgentProgress getProgress(String capabilityName) {
        requireName(capabilityName);
        var events = store.readAll(capabilityName);
        if (events.isEmpty() && !discovered.test(capabilityName)) {
            throw new UnknownCapabilityException(capabilityName);
        }
        return calculator.fold(capabilityName, events);
    }

    public List<XpEvent> history(String capabilityName) {
        requireName(capabilityName);
        return store.readAll(capabilityName);
    }

    public Set<String> trackedCapabilities() {
        return store.capabilityNames();
    }

    public boolean isKnown(String capabilityName) {
        requireName(capabilityName);
        return discovered.test(capabilityName) || !store.readAll(capabilityName).isEmpty();
    }

    public LevelTable levels() {
        return calculator.levels();
    }

    public LedgerStore store() {
        return store;
    }

    /** Folds already-read events without touching the store. */
    public AgentProgress fold(String capabilityName, List<XpEvent> events) {
        return calculator.fold(capabilityName, events);
    }

    /**
     * @throws IllegalArgumentException if the name is null or blank
     */
    public static String requireName(String capabilityName) {
        if (capabilityName == null || capabilityName.isBlank()) {
            throw new IllegalArgumentException("capabilityName is required");
        }
        return capabilityName;
    }

    private void requireKnown(String capabilityName) {
        if (!isKnown(capabilityName)) {
            throw new UnknownCapabilityException(capabilityName);
        }
    }
}
