package com.agentarena.recommend;

import com.agentarena.shared.model.ProjectSignature;
import com.agentarena.shared.model.ProjectType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Rough effort estimate and task list for a request, from per-project-type templates.
 *
 * <p>Complexity is scaled to ten points ({@code 2 * complexity}); hours are
 * {@code baseHours * (1 + (points - 3) * 0.3)}, truncated. At three points or fewer complex tasks
 * are marked "Simplified", at seven or more every task is marked "Advanced".
 */
public class WorkEstimator {

    private static final Map<ProjectType, Integer> BASE_HOURS = baseHours();
    private static final Map<ProjectType, List<TaskTemplate>> TEMPLATES = templates();

    public WorkEstimate estimate(ProjectSignature signature) {
        int points = signature.complexity() * 2;
        return new WorkEstimate(hours(signature.projectType(), points), breakdown(signature.projectType(), points));
    }

    static int hours(ProjectType type, int points) {
        // tenths, so truncation is exact
        return BASE_HOURS.get(type) * (10 + 3 * (points - 3)) / 10;
    }

    static List<String> breakdown(ProjectType type, int points) {
        var tasks = new ArrayList<String>();
        for (var t : TEMPLATES.getOrDefault(type, TEMPLATES.get(ProjectType.WEB_APP))) {
            if (points <= 3 && t.complex()) {
                tasks.add("Simplified: " + t.description());
            } else if (points >= 7) {
                tasks.add("Advanced: " + t.description());
            } else {
                tasks.add(t.description());
            }
        }
        return tasks;
    }

    private record TaskTemplate(String description, boolean complex) {}

    private static Map<ProjectType, Integer> baseHours() {
        var map = new EnumMap<ProjectType, Integer>(ProjectType.class);
        map.put(ProjectType.WEB_APP, 40);
        map.put(ProjectType.API_SERVICE, 20);
        map.put(ProjectType.DATA_PIPELINE, 30);
        map.put(ProjectType.GENERIC, 30);
        return Collections.unmodifiableMap(map);
    }

    // generic requests reuse the web-app template
    private static Map<ProjectType, List<TaskTemplate>> templates() {
        var map = new EnumMap<ProjectType, List<TaskTemplate>>(ProjectType.class);
        map.put(ProjectType.WEB_APP, List.of(
            new TaskTemplate("Design system architecture and component structure", true),
            new TaskTemplate("Design and implement backend API endpoints", true),
            new TaskTemplate("Implement frontend components and user interface", true),
            new TaskTemplate("Set up database schema and data models", false),
            new TaskTemplate("Implement authentication and security measures", true),
            new TaskTemplate("Write comprehensive tests and quality assurance", false),
            new TaskTemplate("Set up deployment pipeline and infrastructure", false)));
        map.put(ProjectType.API_SERVICE, List.of(
            new TaskTemplate("Design RESTful API architecture and endpoints", true),
            new TaskTemplate("Implement API business logic and data access", true),
            new TaskTemplate("Set up authentication and authorization", true),
            new TaskTemplate("Create comprehensive API documentation", false),
            new TaskTemplate("Implement rate limiting and performance optimization", false),
            new TaskTemplate("Write API tests and integration tests", false)));
        map.put(ProjectType.DATA_PIPELINE, List.of(
            new TaskTemplate("Design data pipeline architecture and flow", true),
            new TaskTemplate("Implement data ingestion and processing logic", true),
            new TaskTemplate("Set up data storage and warehousing", false),
            new TaskTemplate("Implement data validation and quality checks", false),
            new TaskTemplate("Create monitoring and alerting system", false)));
        return Collections.unmodifiableMap(map);
    }
}
