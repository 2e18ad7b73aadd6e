package com.agentarena.progression;

/**
 * Receives progression notifications after the corresponding events are durable.
 * A listener that throws is logged and skipped.
 */
@FunctionalInterface
public interface ProgressionListener {
    void onNotification(ProgressionNotification notification);
}
