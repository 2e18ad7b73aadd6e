package com.agentarena.shared.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

public record ArenaConfig(
    List<Path> searchRoots,
    Duration cacheTtl,
    Path ledgerFile,
    ProgressionConfig progression,
    RecommendationConfig recommendation
) {}
