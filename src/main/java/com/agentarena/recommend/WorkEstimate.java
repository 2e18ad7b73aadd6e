package com.agentarena.recommend;

import java.util.List;

public record WorkEstimate(int estimatedHours, List<String> taskBreakdown) {
    public WorkEstimate {
        taskBreakdown = List.copyOf(taskBreakdown);
    }
}
