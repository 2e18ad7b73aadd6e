package com.agentarena.recommend;

import com.agentarena.shared.model.Category;

public enum SquadRole {
    LEAD,
    BUILDER,
    VERIFIER,
    GUARDIAN,
    OPERATOR,
    ANALYST,
    STRATEGIST,
    ADVISOR,
    COORDINATOR,
    SPECIALIST;

    static SquadRole forCategory(Category category) {
        return switch (category) {
            case DEVELOPMENT -> BUILDER;
            case QUALITY -> VERIFIER;
            case SECURITY -> GUARDIAN;
            case INFRASTRUCTURE -> OPERATOR;
            case DATA -> ANALYST;
            case PRODUCT -> STRATEGIST;
            case BUSINESS -> ADVISOR;
            case COORDINATION -> COORDINATOR;
            case UNCATEGORIZED -> SPECIALIST;
        };
    }
}
