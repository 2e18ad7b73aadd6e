package com.agentarena.recommend;

import com.agentarena.shared.model.Category;
import com.agentarena.shared.model.ProjectType;

import java.util.EnumMap;
import java.util.Map;

/**
 * How well each capability category fits each project type, in [0, 1].
 */
final class CategoryAffinity {

    private static final double DEFAULT_AFFINITY = 0.2;
    private static final Map<ProjectType, Map<Category, Double>> TABLE = new EnumMap<>(ProjectType.class);

    static {
        put(ProjectType.WEB_APP, Map.of(
            Category.DEVELOPMENT, 1.0, Category.QUALITY, 0.6, Category.SECURITY, 0.5,
            Category.INFRASTRUCTURE, 0.5, Category.PRODUCT, 0.4, Category.COORDINATION, 0.3));
        put(ProjectType.API_SERVICE, Map.of(
            Category.DEVELOPMENT, 1.0, Category.SECURITY, 0.7, Category.QUALITY, 0.6,
            Category.INFRASTRUCTURE, 0.5, Category.DATA, 0.3, Category.PRODUCT, 0.3, Category.COORDINATION, 0.3));
        put(ProjectType.DATA_PIPELINE, Map.of(
            Category.DATA, 1.0, Category.INFRASTRUCTURE, 0.7, Category.DEVELOPMENT, 0.5,
            Category.QUALITY, 0.5, Category.SECURITY, 0.3, Category.COORDINATION, 0.3));
        put(ProjectType.GENERIC, Map.of(
            Category.DEVELOPMENT, 0.5, Category.QUALITY, 0.4, Category.COORDINATION, 0.4,
            Category.INFRASTRUCTURE, 0.3, Category.SECURITY, 0.3, Category.DATA, 0.3, Category.PRODUCT, 0.3));
    }

    private CategoryAffinity() {}

    static double of(Category category, ProjectType type) {
        return TABLE.getOrDefault(type, Map.of()).getOrDefault(category, DEFAULT_AFFINITY);
    }

    private static void put(ProjectType type, Map<Category, Double> affinities) {
        TABLE.put(type, new EnumMap<>(affinities));
    }
}
