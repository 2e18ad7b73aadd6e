package com.agentarena.ledger;

public class UnknownCapabilityException extends RuntimeException {

    private final String capabilityName;

    public UnknownCapabilityException(String capabilityName) {
        super("Unknown capability '" + capabilityName
            + "': it was never discovered in any search root and has no recorded history");
        this.capabilityName = capabilityName;
    }

    public String capabilityName() {
        return capabilityName;
    }
}
