package com.agentarena.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ConfigLoader {

    private static final Path HOME = Path.of(System.getProperty("user.home"), ".agentarena");
    private static final Path DEFAULT_PATH = HOME.resolve("config.yaml");
    private static final long DEFAULT_CACHE_TTL_SECONDS = 300;

    public static ArenaConfig load() {
        return load(DEFAULT_PATH);
    }

    @SuppressWarnings("unchecked")
    public static ArenaConfig load(Path path) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var registry = (Map<String, Object>) raw.getOrDefault("registry", Map.of());
        var ledger = (Map<String, Object>) raw.getOrDefault("ledger", Map.of());
        var progression = (Map<String, Object>) raw.getOrDefault("progression", Map.of());
        var recommendation = (Map<String, Object>) raw.getOrDefault("recommendation", Map.of());

        return new ArenaConfig(
            parseSearchRoots(registry),
            Duration.ofSeconds(Long.parseLong(envOrDefault("ARENA_CACHE_TTL",
                String.valueOf(registry.getOrDefault("cache-ttl-seconds", DEFAULT_CACHE_TTL_SECONDS))))),
            expand(envOrDefault("ARENA_LEDGER_FILE",
                String.valueOf(ledger.getOrDefault("file", HOME.resolve("ledger.json").toString())))),
            parseProgressionConfig(progression),
            parseRecommendationConfig(recommendation)
        );
    }

    /** Lowest priority first: the global root, then project-local roots which override it. */
    public static List<Path> defaultSearchRoots() {
        return List.of(
            HOME.resolve("agents"),
            Path.of("agents").toAbsolutePath(),
            Path.of("custom_agents").toAbsolutePath()
        );
    }

    private static List<Path> parseSearchRoots(Map<String, Object> registry) {
        var env = System.getenv("ARENA_SEARCH_ROOTS");
        if (env != null && !env.isBlank()) {
            return splitRoots(env);
        }
        if (!registry.containsKey("search-roots")) {
            return defaultSearchRoots();
        }
        return ((List<?>) registry.get("search-roots")).stream()
            .map(String::valueOf)
            .map(ConfigLoader::expand)
            .toList();
    }

    static List<Path> splitRoots(String value) {
        var roots = new ArrayList<Path>();
        for (var part : value.split(File.pathSeparator)) {
            if (!part.isBlank()) roots.add(expand(part.trim()));
        }
        return List.copyOf(roots);
    }

    @SuppressWarnings("unchecked")
    private static ProgressionConfig parseProgressionConfig(Map<String, Object> progression) {
        var defaults = ProgressionConfig.defaults();
        var thresholds = progression.containsKey("level-thresholds")
            ? ((List<?>) progression.get("level-thresholds")).stream()
                .map(v -> Long.parseLong(String.valueOf(v)))
                .toList()
            : defaults.levelThresholds();

        Map<String, Integer> tiers = defaults.tiers();
        if (progression.containsKey("tiers")) {
            var parsed = new LinkedHashMap<String, Integer>();
            ((Map<String, Object>) progression.get("tiers"))
                .forEach((name, level) -> parsed.put(name, Integer.parseInt(String.valueOf(level))));
            tiers = parsed;
        }
        return new ProgressionConfig(thresholds, tiers);
    }

    @SuppressWarnings("unchecked")
    private static RecommendationConfig parseRecommendationConfig(Map<String, Object> recommendation) {
        var weights = (Map<String, Object>) recommendation.getOrDefault("weights", Map.of());
        var squad = (Map<String, Object>) recommendation.getOrDefault("squad", Map.of());

        var weightsDef = RecommendationConfig.Weights.defaults();
        var squadDef = RecommendationConfig.SquadConfig.defaults();

        var synergies = recommendation.containsKey("synergies")
            ? ((List<Map<String, Object>>) recommendation.get("synergies")).stream()
                .map(s -> new RecommendationConfig.Synergy(
                    ((List<?>) s.getOrDefault("members", List.of())).stream().map(String::valueOf).toList(),
                    Integer.parseInt(String.valueOf(s.getOrDefault("bonus", 0)))))
                .toList()
            : RecommendationConfig.defaultSynergies();

        return new RecommendationConfig(
            new RecommendationConfig.Weights(
                Double.parseDouble(String.valueOf(weights.getOrDefault("tech", weightsDef.tech()))),
                Double.parseDouble(String.valueOf(weights.getOrDefault("category", weightsDef.category()))),
                Double.parseDouble(String.valueOf(weights.getOrDefault("history", weightsDef.history())))
            ),
            new RecommendationConfig.SquadConfig(
                Integer.parseInt(String.valueOf(squad.getOrDefault("min-size", squadDef.minSize()))),
                Integer.parseInt(String.valueOf(squad.getOrDefault("max-size", squadDef.maxSize()))),
                Integer.parseInt(String.valueOf(squad.getOrDefault("max-per-category", squadDef.maxPerCategory()))),
                Integer.parseInt(String.valueOf(squad.getOrDefault("synergy-cap", squadDef.synergyCapPercent())))
            ),
            synergies
        );
    }

    static Path expand(String raw) {
        if (raw.equals("~")) return Path.of(System.getProperty("user.home"));
        if (raw.startsWith("~/")) return Path.of(System.getProperty("user.home"), raw.substring(2));
        return Path.of(raw).toAbsolutePath();
    }

    private static String envOrDefault(String env, String fallback) {
        var val = System.getenv(env);
        return val != null ? val : fallback;
    }
}
