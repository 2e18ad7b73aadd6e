package com.agentarena.ledger;

import com.agentarena.shared.model.NewXpEvent;
import com.agentarena.shared.model.XpEvent;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Process-local store. Holds no derived state, so it can never become inconsistent.
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final Clock clock;
    private final List<XpEvent> events = new ArrayList<>();
    private long nextEventId = 1;

    public InMemoryLedgerStore() {
        this(Clock.systemUTC());
    }

    public InMemoryLedgerStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized XpEvent append(NewXpEvent e) {
        var event = new XpEvent(nextEventId++, e.capabilityName(), clock.instant(), e.taskLabel(),
            e.outcome(), e.baseXp(), e.bonusXp(), e.kind(), e.achievementKey(), e.durationMillis());
        events.add(event);
        return event;
    }

    @Override
    public synchronized XpEvent appendIfAbsent(NewXpEvent e) {
        if (e.achievementKey() == null) {
            throw new IllegalArgumentException("appendIfAbsent needs an achievement key for '" + e.capabilityName() + "'");
        }
        boolean present = events.stream()
            .anyMatch(ev -> ev.capabilityName().equals(e.capabilityName()) && e.achievementKey().equals(ev.achievementKey()));
        return present ? null : append(e);
    }

    @Override
    public synchronized List<XpEvent> readAll(String capabilityName) {
        return events.stream().filter(e -> e.capabilityName().equals(capabilityName)).toList();
    }

    @Override
    public synchronized List<XpEvent> readAll() {
        return events.stream().sorted(Comparator.comparingLong(XpEvent::eventId)).toList();
    }

    @Override
    public synchronized Set<String> capabilityNames() {
        var names = new TreeSet<String>();
        events.forEach(e -> names.add(e.capabilityName()));
        return names;
    }

    @Override
    public synchronized LedgerVerification verify() {
        return new LedgerVerification(true, capabilityNames().size(), events.size(), List.of());
    }

    @Override
    public LedgerVerification rebuild() {
        return verify();
    }
}
