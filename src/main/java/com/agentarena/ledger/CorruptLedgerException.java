package com.agentarena.ledger;

import java.util.List;

/**
 * Raised on the write path while persisted progression state fails its self-consistency check.
 * Writes stay refused until {@link LedgerStore#rebuild()} succeeds.
 */
public class CorruptLedgerException extends RuntimeException {

    private final List<String> problems;

    public CorruptLedgerException(String location, List<String> problems) {
        super("Ledger " + location + " failed consistency check, refusing to write until rebuilt: "
            + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public CorruptLedgerException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public List<String> problems() {
        return problems;
    }
}
