package com.agentarena.shared.model;

public enum ProjectType {
    WEB_APP("web-app"),
    API_SERVICE("api-service"),
    DATA_PIPELINE("data-pipeline"),
    GENERIC("generic");

    private final String id;

    ProjectType(String id) {
        this.id = id;
    }

    public String id() { return id; }
}
