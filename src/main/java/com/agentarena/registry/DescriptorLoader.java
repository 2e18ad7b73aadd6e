package com.agentarena.registry;

import com.agentarena.classify.TechStackClassifier;
import com.agentarena.shared.model.CapabilityDescriptor;
import com.agentarena.shared.model.Category;
import com.agentarena.shared.model.Difficulty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.DuplicateKeyException;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses capability descriptor files: a {@code ---} delimited YAML header followed by free-form body text.
 * A bad file yields a {@link ParseFailure}; nothing here throws for a single file.
 */
public class DescriptorLoader {

    private static final Logger log = LoggerFactory.getLogger(DescriptorLoader.class);

    private static final Pattern FRONT_MATTER = Pattern.compile("\\A---[ \\t]*\\R(.*?)\\R---[ \\t]*(?:\\R(.*))?\\z", Pattern.DOTALL);
    private static final Pattern HEADER_LINE = Pattern.compile("^([A-Za-z0-9_-]+)\\s*:\\s*(.*)$");
    private static final Set<String> KNOWN_KEYS = Set.of("name", "summary", "description", "category", "color", "tools", "difficulty");
    private static final List<Pattern> SPECIALTY_SECTIONS = List.of(
        Pattern.compile("^##+ (?:core )?competenc(?:y|ies).*?(?=^##|\\z)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL | Pattern.MULTILINE),
        Pattern.compile("^##+ (?:my )?specialt(?:y|ies).*?(?=^##|\\z)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL | Pattern.MULTILINE),
        Pattern.compile("^##+ (?:key )?(?:skills?|expertise).*?(?=^##|\\z)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL | Pattern.MULTILINE),
        Pattern.compile("^##+ (?:my )?approach.*?(?=^##|\\z)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL | Pattern.MULTILINE)
    );
    private static final int MAX_SPECIALTIES = 5;

    // first matching level wins, in this order
    private static final Map<Difficulty, List<String>> DIFFICULTY_INDICATORS = difficultyIndicators();

    private final TechStackClassifier classifier;

    public DescriptorLoader(TechStackClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Loads every {@code *.md} file below {@code root}, in path order.
     */
    public ScanResult loadFrom(Path root) {
        if (!Files.isDirectory(root)) {
            log.debug("Search root does not exist, skipping: {}", root);
            return new ScanResult(List.of(), List.of());
        }
        List<Path> files;
        try (var stream = Files.walk(root)) {
            files = stream
                .filter(p -> p.getFileName().toString().endsWith(".md"))
                .filter(Files::isRegularFile)
                .sorted()
                .toList();
        } catch (IOException | UncheckedIOException e) {
            log.warn("Failed to scan search root {}: {}", root, e.getMessage());
            return new ScanResult(List.of(), List.of(
                new ParseFailure(root, ParseFailure.Kind.UNREADABLE_DIRECTORY, "cannot list directory: " + e.getMessage())));
        }

        var descriptors = new ArrayList<CapabilityDescriptor>();
        var failures = new ArrayList<ParseFailure>();
        for (var file : files) {
            var result = load(root, file);
            if (result.isOk()) {
                descriptors.add(result.descriptor());
                log.debug("Discovered capability '{}' in {}", result.descriptor().name(), file);
            } else {
                failures.add(result.failure());
                log.warn("Skipping descriptor {}", result.failure());
            }
        }
        return new ScanResult(descriptors, failures);
    }

    public LoadResult load(Path root, Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException | RuntimeException e) {
            return fail(file, ParseFailure.Kind.UNREADABLE, "cannot read file: " + e.getMessage());
        }
        if (content.startsWith("\uFEFF")) content = content.substring(1);

        if (!content.startsWith("---")) {
            return fail(file, ParseFailure.Kind.MISSING_FIELD, "no metadata header; required fields: name, summary");
        }
        var m = FRONT_MATTER.matcher(content);
        if (!m.matches()) {
            return fail(file, ParseFailure.Kind.MALFORMED_HEADER, "metadata header is not closed with '---'");
        }
        var headerText = m.group(1);
        var body = m.group(2) == null ? "" : m.group(2).strip();

        Map<String, Object> header;
        try {
            header = parseHeader(headerText);
        } catch (DuplicateKeyException e) {
            return fail(file, ParseFailure.Kind.DUPLICATE_KEY, oneLine(e.getMessage()));
        } catch (HeaderException e) {
            return fail(file, e.kind, e.getMessage());
        }

        var name = text(header.get("name"));
        if (name == null) {
            return fail(file, ParseFailure.Kind.MISSING_FIELD, "required field 'name' is missing");
        }
        var summary = text(header.containsKey("summary") ? header.get("summary") : header.get("description"));
        if (summary == null) {
            return fail(file, ParseFailure.Kind.MISSING_FIELD, "required field 'summary' is missing for '" + name + "'");
        }

        var classifiedText = summary + "\n" + body;
        var extensions = new LinkedHashMap<String, Object>();
        header.forEach((k, v) -> {
            if (!KNOWN_KEYS.contains(k) && v != null) extensions.put(k, v);
        });

        return LoadResult.ok(new CapabilityDescriptor(
            name,
            summary,
            resolveCategory(root, file, text(header.get("category"))),
            classifier.classify(classifiedText),
            root,
            file,
            text(header.get("color")),
            tools(header.get("tools")),
            resolveDifficulty(text(header.get("difficulty")), classifiedText),
            extractSpecialties(body),
            extensions,
            body
        ));
    }

    private Map<String, Object> parseHeader(String headerText) {
        var options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Object parsed;
        try {
            parsed = new Yaml(options).load(headerText);
        } catch (DuplicateKeyException e) {
            throw e;
        } catch (YAMLException e) {
            // agent files often carry unquoted colons in prose values; read them line by line
            return parseSimpleHeader(headerText);
        }
        if (parsed == null) return Map.of();
        if (!(parsed instanceof Map<?, ?> map)) {
            throw new HeaderException(ParseFailure.Kind.MALFORMED_HEADER, "metadata header is not a key/value block");
        }
        var header = new LinkedHashMap<String, Object>();
        map.forEach((k, v) -> header.put(String.valueOf(k), v));
        return header;
    }

    private Map<String, Object> parseSimpleHeader(String headerText) {
        var header = new LinkedHashMap<String, Object>();
        for (var line : headerText.split("\\R")) {
            var trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            var m = HEADER_LINE.matcher(trimmed);
            if (!m.matches()) {
                throw new HeaderException(ParseFailure.Kind.MALFORMED_HEADER, "unparseable header line: " + trimmed);
            }
            var key = m.group(1);
            if (header.containsKey(key)) {
                throw new HeaderException(ParseFailure.Kind.DUPLICATE_KEY, "duplicate key '" + key + "' in metadata header");
            }
            header.put(key, unquote(m.group(2).strip()));
        }
        return header;
    }

    private static Category resolveCategory(Path root, Path file, String declared) {
        var fromHeader = Category.fromName(declared);
        if (fromHeader != null) return fromHeader;
        var relative = root.relativize(file);
        if (relative.getNameCount() > 1) {
            var fromDir = Category.fromName(relative.getName(0).toString());
            if (fromDir != null) return fromDir;
        }
        return Category.UNCATEGORIZED;
    }

    private static Difficulty resolveDifficulty(String declared, String text) {
        var fromHeader = Difficulty.fromName(declared);
        if (fromHeader != null) return fromHeader;
        var lower = text.toLowerCase(Locale.ROOT);
        for (var entry : DIFFICULTY_INDICATORS.entrySet()) {
            if (entry.getValue().stream().anyMatch(lower::contains)) return entry.getKey();
        }
        return Difficulty.INTERMEDIATE;
    }

    static List<String> extractSpecialties(String body) {
        var specialties = new ArrayList<String>();
        for (var section : SPECIALTY_SECTIONS) {
            var m = section.matcher(body);
            while (m.find()) {
                for (var line : m.group().split("\\R")) {
                    var trimmed = line.strip();
                    if (trimmed.startsWith("- ") || trimmed.startsWith("* ")) {
                        var item = trimmed.substring(2).strip();
                        if (!item.isEmpty() && item.length() < 100) specialties.add(item);
                    }
                }
            }
        }
        return specialties.stream().distinct().limit(MAX_SPECIALTIES).toList();
    }

    private static String tools(Object raw) {
        if (raw == null) return null;
        if (raw instanceof List<?> list) {
            return list.stream().map(String::valueOf).collect(Collectors.joining(", "));
        }
        return text(raw);
    }

    private static String text(Object raw) {
        if (raw == null) return null;
        var s = String.valueOf(raw).strip();
        return s.isEmpty() ? null : s;
    }

    private static String unquote(String value) {
        if (value.length() >= 2
            && ((value.startsWith("\"") && value.endsWith("\"")) || (value.startsWith("'") && value.endsWith("'")))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static String oneLine(String message) {
        if (message == null) return "duplicate key in metadata header";
        var lines = message.strip().split("\\R");
        return String.join(" ", lines).replaceAll("\\s+", " ");
    }

    private static LoadResult fail(Path file, ParseFailure.Kind kind, String message) {
        return LoadResult.failed(new ParseFailure(file, kind, message));
    }

    private static Map<Difficulty, List<String>> difficultyIndicators() {
        var map = new LinkedHashMap<Difficulty, List<String>>();
        map.put(Difficulty.BEGINNER, List.of("simple", "basic", "getting started", "intro"));
        map.put(Difficulty.INTERMEDIATE, List.of("experience", "skilled", "proficient"));
        map.put(Difficulty.ADVANCED, List.of("expert", "master", "senior", "architect"));
        map.put(Difficulty.EXPERT, List.of("elite", "battle-tested", "legendary", "guru"));
        return map;
    }

    private static final class HeaderException extends RuntimeException {
        private final ParseFailure.Kind kind;

        HeaderException(ParseFailure.Kind kind, String message) {
            super(message);
            this.kind = kind;
        }
    }

    public record ScanResult(List<CapabilityDescriptor> descriptors, List<ParseFailure> failures) {}
}
