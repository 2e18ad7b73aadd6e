package com.agentarena.registry;

import java.nio.file.Path;

/**
 * Why one descriptor file (or one root directory) could not be indexed.
 */
public record ParseFailure(Path path, Kind kind, String message) {

    public enum Kind { MISSING_FIELD, UNREADABLE, DUPLICATE_KEY, MALFORMED_HEADER, UNREADABLE_DIRECTORY }

    @Override
    public String toString() {
        return "[" + kind + "] " + path + ": " + message;
    }
}
