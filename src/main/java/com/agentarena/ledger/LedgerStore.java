package com.agentarena.ledger;

import com.agentarena.shared.model.NewXpEvent;
import com.agentarena.shared.model.XpEvent;

import java.util.List;
import java.util.Set;

/**
 * Append-only event storage. Implementations assign ids and timestamps, never rewrite an
 * appended event, and keep any cached summaries consistent with the raw events.
 */
public interface LedgerStore {

    /**
     * @throws CorruptLedgerException when the stored state fails its consistency checks
     */
    XpEvent append(NewXpEvent event);

    /**
     * Appends an achievement event unless the capability already holds one with the same
     * {@code achievementKey}. Check and append are one atomic step.
     *
     * @return the new event, or {@code null} when the key was already present
     * @throws IllegalArgumentException if the event carries no achievement key
     * @throws CorruptLedgerException when the stored state fails its consistency checks
     */
    XpEvent appendIfAbsent(NewXpEvent event);

    /** Events for one capability in {@code eventId} order; empty if none. */
    List<XpEvent> readAll(String capabilityName);

    /** Every event in {@code eventId} order. */
    List<XpEvent> readAll();

    Set<String> capabilityNames();

    LedgerVerification verify();

    /** Recomputes all derived state from the raw events and clears a corrupt flag. */
    LedgerVerification rebuild();
}
