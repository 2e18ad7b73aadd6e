package com.agentarena.shared.model;

import java.util.Locale;
import java.util.Map;

/**
 * Capability category, normally derived from the directory a descriptor lives in.
 */
public enum Category {
    DEVELOPMENT("development"),
    INFRASTRUCTURE("infrastructure"),
    QUALITY("quality"),
    SECURITY("security"),
    DATA("data"),
    PRODUCT("product"),
    BUSINESS("business"),
    COORDINATION("coordination"),
    UNCATEGORIZED("uncategorized");

    private static final Map<String, Category> ALIASES = Map.of(
        "conductor", COORDINATION,
        "qa", QUALITY,
        "quality-assurance", QUALITY,
        "data-ai", DATA,
        "infra", INFRASTRUCTURE
    );

    private final String id;

    Category(String id) {
        this.id = id;
    }

    public String id() { return id; }

    /**
     * Resolves a directory name or header value. Returns {@code null} when nothing matches.
     */
    public static Category fromName(String raw) {
        if (raw == null || raw.isBlank()) return null;
        var key = raw.trim().toLowerCase(Locale.ROOT).replace(' ', '-').replace("&", "").replace("--", "-");
        for (var c : values()) {
            if (c.id.equals(key)) return c;
        }
        return ALIASES.get(key);
    }
}
