package com.agentarena.shared.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() {
        var config = ConfigLoader.load(tempDir.resolve("absent.yaml"));
        assertEquals(ProgressionConfig.defaults(), config.progression());
        assertEquals(RecommendationConfig.Weights.defaults(), config.recommendation().weights());
        assertEquals(RecommendationConfig.SquadConfig.defaults(), config.recommendation().squad());
        assertEquals(RecommendationConfig.defaultSynergies(), config.recommendation().synergies());
    }

    @Test
    void emptyFileGivesDefaults() throws IOException {
        var file = tempDir.resolve("config.yaml");
        Files.writeString(file, "");
        var config = ConfigLoader.load(file);
        assertEquals(ProgressionConfig.defaults(), config.progression());
    }

    @Test
    void parsesAllSections() throws IOException {
        var file = tempDir.resolve("config.yaml");
        Files.writeString(file, """
                registry:
                  search-roots:
                    - ~/global-agents
                    - %s
                  cache-ttl-seconds: 60
                ledger:
                  file: %s
                progression:
                  level-thresholds: [0, 10, 30]
                  tiers:
                    Rookie: 1
                    Pro: 3
                recommendation:
                  weights:
                    tech: 0.5
                    category: 0.4
                    history: 0.1
                  squad:
                    min-size: 2
                    max-size: 4
                    max-per-category: 1
                    synergy-cap: 20
                  synergies:
                    - members: [a, b]
                      bonus: 12
                """.formatted(tempDir.resolve("local"), tempDir.resolve("ledger.json")));

        var config = ConfigLoader.load(file);

        if (System.getenv("ARENA_SEARCH_ROOTS") == null) {
            assertEquals(List.of(Path.of(System.getProperty("user.home"), "global-agents"), tempDir.resolve("local")),
                    config.searchRoots());
        }
        if (System.getenv("ARENA_CACHE_TTL") == null) {
            assertEquals(Duration.ofSeconds(60), config.cacheTtl());
        }
        if (System.getenv("ARENA_LEDGER_FILE") == null) {
            assertEquals(tempDir.resolve("ledger.json"), config.ledgerFile());
        }
        assertEquals(List.of(0L, 10L, 30L), config.progression().levelThresholds());
        assertEquals(Map.of("Rookie", 1, "Pro", 3), config.progression().tiers());
        assertEquals(new RecommendationConfig.Weights(0.5, 0.4, 0.1), config.recommendation().weights());
        assertEquals(new RecommendationConfig.SquadConfig(2, 4, 1, 20), config.recommendation().squad());
        assertEquals(List.of(new RecommendationConfig.Synergy(List.of("a", "b"), 12)),
                config.recommendation().synergies());
    }

    @Test
    void rejectsWeightsWhereCategoryDominatesTech() throws IOException {
        var file = tempDir.resolve("config.yaml");
        Files.writeString(file, "recommendation:\n  weights:\n    tech: 0.2\n    category: 0.5\n    history: 0.1\n");
        var ex = assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(file));
        assertTrue(ex.getMessage().contains("tech > category > history"));
    }

    @Test
    void splitsRootListOnPathSeparator() {
        var roots = ConfigLoader.splitRoots("/a" + File.pathSeparator + " " + File.pathSeparator + "/b");
        assertEquals(List.of(Path.of("/a"), Path.of("/b")), roots);
    }

    @Test
    void expandsHomeDirectory() {
        assertEquals(Path.of(System.getProperty("user.home"), "x", "y"), ConfigLoader.expand("~/x/y"));
        assertEquals(Path.of(System.getProperty("user.home")), ConfigLoader.expand("~"));
    }

    @Test
    void defaultRootsPutGlobalFirst() {
        var roots = ConfigLoader.defaultSearchRoots();
        assertEquals(3, roots.size());
        assertEquals(Path.of(System.getProperty("user.home"), ".agentarena", "agents"), roots.get(0));
        assertTrue(roots.get(2).endsWith("custom_agents"));
    }
}
