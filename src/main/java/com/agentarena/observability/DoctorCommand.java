package com.agentarena.observability;

import com.agentarena.ledger.LedgerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class DoctorCommand {

    private static final Logger log = LoggerFactory.getLogger(DoctorCommand.class);

    private final List<Path> searchRoots;
    private final LedgerStore ledger;

    public DoctorCommand(List<Path> searchRoots, LedgerStore ledger) {
        this.searchRoots = List.copyOf(searchRoots);
        this.ledger = ledger;
    }

    public String run() {
        var results = new ArrayList<String>();
        searchRoots.forEach(root -> results.add(checkSearchRoot(root)));
        results.add(checkLedger());
        results.add(checkJavaVersion());
        return String.join("\n", results);
    }

    private String checkSearchRoot(Path root) {
        if (!Files.exists(root)) {
            return "[WARN] Search root not found (skipped): " + root;
        }
        if (!Files.isDirectory(root) || !Files.isReadable(root)) {
            return "[FAIL] Search root not a readable directory: " + root;
        }
        return "[OK] Search root " + root;
    }

    private String checkLedger() {
        try {
            return ledger.verify().describe();
        } catch (RuntimeException e) {
            log.warn("Ledger check failed", e);
            return "[FAIL] Ledger: " + e.getMessage();
        }
    }

    private String checkJavaVersion() {
        var ver = Runtime.version().feature();
        return ver >= 17
                ? "[OK] Java " + ver
                : "[WARN] Java " + ver + " (17+ required)";
    }
}
