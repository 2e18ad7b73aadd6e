package com.agentarena.registry;

import com.agentarena.shared.model.CapabilityDescriptor;
import com.agentarena.shared.model.Category;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable snapshot of the registry, keyed by capability name and bucketed by category and tag.
 */
public final class RegistryIndex {

    private final Map<String, CapabilityDescriptor> byName;
    private final Map<Category, List<CapabilityDescriptor>> byCategory = new EnumMap<>(Category.class);
    private final Map<String, List<CapabilityDescriptor>> byTag = new HashMap<>();
    private final Instant builtAt;

    public RegistryIndex(Collection<CapabilityDescriptor> descriptors, Instant builtAt) {
        var sorted = descriptors.stream().sorted(Comparator.comparing(CapabilityDescriptor::name)).toList();
        var names = new LinkedHashMap<String, CapabilityDescriptor>();
        for (var d : sorted) {
            if (names.putIfAbsent(d.name(), d) != null) {
                throw new IllegalArgumentException("Duplicate capability name in index: " + d.name());
            }
            byCategory.computeIfAbsent(d.category(), k -> new ArrayList<>()).add(d);
            for (var tag : d.techStackTags()) {
                byTag.computeIfAbsent(tag, k -> new ArrayList<>()).add(d);
            }
        }
        this.byName = Collections.unmodifiableMap(names);
        this.builtAt = builtAt;
    }

    public static RegistryIndex empty(Instant builtAt) {
        return new RegistryIndex(List.of(), builtAt);
    }

    public Optional<CapabilityDescriptor> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    /** All descriptors, sorted by name. */
    public List<CapabilityDescriptor> all() {
        return List.copyOf(byName.values());
    }

    public int size() {
        return byName.size();
    }

    public boolean isEmpty() {
        return byName.isEmpty();
    }

    public Instant builtAt() {
        return builtAt;
    }

    public List<CapabilityDescriptor> search(SearchFilter filter) {
        if (filter == null || filter.isEmpty()) return all();
        return candidates(filter).stream()
            .filter(filter::matches)
            .sorted(Comparator.comparing(CapabilityDescriptor::name))
            .toList();
    }

    private Collection<CapabilityDescriptor> candidates(SearchFilter filter) {
        if (!filter.categories().isEmpty()) {
            var result = new ArrayList<CapabilityDescriptor>();
            for (var c : filter.categories()) {
                result.addAll(byCategory.getOrDefault(c, List.of()));
            }
            return result;
        }
        if (!filter.techStack().isEmpty()) {
            List<CapabilityDescriptor> smallest = null;
            for (var tag : filter.techStack()) {
                var bucket = byTag.getOrDefault(tag, List.of());
                if (smallest == null || bucket.size() < smallest.size()) smallest = bucket;
            }
            return smallest;
        }
        return byName.values();
    }

    public SortedSet<Category> categories() {
        return new TreeSet<>(byCategory.keySet());
    }

    public SortedSet<String> techStacks() {
        return new TreeSet<>(byTag.keySet());
    }

    public Map<Category, Integer> categoryCounts() {
        var counts = new EnumMap<Category, Integer>(Category.class);
        byCategory.forEach((c, list) -> counts.put(c, list.size()));
        return counts;
    }

    /**
     * Capabilities resembling {@code name}: same category +3, each shared tag +2, same difficulty +1.
     */
    public List<CapabilityDescriptor> similarTo(String name, int limit) {
        var target = byName.get(name);
        if (target == null) return List.of();
        record Scored(CapabilityDescriptor d, int score) {}
        var scored = new ArrayList<Scored>();
        for (var d : byName.values()) {
            if (d.name().equals(name)) continue;
            int score = 0;
            if (d.category() == target.category()) score += 3;
            score += 2 * (int) d.techStackTags().stream().filter(target.techStackTags()::contains).count();
            if (d.difficulty() == target.difficulty()) score += 1;
            if (score > 0) scored.add(new Scored(d, score));
        }
        return scored.stream()
            .sorted(Comparator.comparingInt(Scored::score).reversed().thenComparing(s -> s.d().name()))
            .limit(limit)
            .map(Scored::d)
            .toList();
    }
}
