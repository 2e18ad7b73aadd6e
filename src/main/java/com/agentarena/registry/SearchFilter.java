package com.agentarena.registry;

import com.agentarena.shared.model.CapabilityDescriptor;
import com.agentarena.shared.model.Category;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Conjunctive registry filter. Empty or {@code null} parts match everything.
 *
 * @param categories    capability must be in one of these categories
 * @param techStack     capability must carry every one of these tags
 * @param minComplexity inclusive lower bound on descriptor complexity (1-5)
 * @param maxComplexity inclusive upper bound on descriptor complexity (1-5)
 * @param query         case-insensitive substring of name, summary or a specialty
 */
public record SearchFilter(
    Set<Category> categories,
    Set<String> techStack,
    Integer minComplexity,
    Integer maxComplexity,
    String query
) {
    public SearchFilter {
        categories = categories == null ? Set.of() : Set.copyOf(categories);
        techStack = techStack == null ? Set.of() : techStack.stream()
            .map(t -> t.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
        if (minComplexity != null && maxComplexity != null && minComplexity > maxComplexity) {
            throw new IllegalArgumentException("Complexity range is empty: " + minComplexity + ".." + maxComplexity);
        }
        if (query != null && query.isBlank()) query = null;
    }

    public static SearchFilter all() {
        return new SearchFilter(Set.of(), Set.of(), null, null, null);
    }

    public SearchFilter withCategories(Set<Category> categories) {
        return new SearchFilter(categories, techStack, minComplexity, maxComplexity, query);
    }

    public SearchFilter withTechStack(Set<String> tags) {
        return new SearchFilter(categories, tags, minComplexity, maxComplexity, query);
    }

    public SearchFilter withComplexity(Integer min, Integer max) {
        return new SearchFilter(categories, techStack, min, max, query);
    }

    public SearchFilter withQuery(String text) {
        return new SearchFilter(categories, techStack, minComplexity, maxComplexity, text);
    }

    public boolean isEmpty() {
        return categories.isEmpty() && techStack.isEmpty() && minComplexity == null && maxComplexity == null && query == null;
    }

    public boolean matches(CapabilityDescriptor d) {
        if (!categories.isEmpty() && !categories.contains(d.category())) return false;
        if (!d.techStackTags().containsAll(techStack)) return false;
        if (minComplexity != null && d.complexity() < minComplexity) return false;
        if (maxComplexity != null && d.complexity() > maxComplexity) return false;
        if (query != null) {
            var q = query.toLowerCase(Locale.ROOT);
            return d.name().toLowerCase(Locale.ROOT).contains(q)
                || d.summary().toLowerCase(Locale.ROOT).contains(q)
                || d.specialties().stream().anyMatch(s -> s.toLowerCase(Locale.ROOT).contains(q));
        }
        return true;
    }
}
