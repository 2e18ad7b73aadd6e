package com.agentarena.ledger;

import java.util.List;

public record LedgerVerification(boolean healthy, int capabilities, int events, List<String> problems) {
    public LedgerVerification {
        problems = List.copyOf(problems);
    }

    public String describe() {
        if (healthy) {
            return "[OK] Ledger consistent: " + capabilities + " capabilities, " + events + " events";
        }
        return "[FAIL] Ledger inconsistent (" + problems.size() + " problems): " + String.join("; ", problems);
    }
}
