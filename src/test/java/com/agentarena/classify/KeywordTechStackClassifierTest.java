package com.agentarena.classify;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KeywordTechStackClassifierTest {

    private final KeywordTechStackClassifier classifier = new KeywordTechStackClassifier();

    @Test
    void findsTagsFromFrameworkNames() {
        var tags = classifier.classify("A React frontend in TypeScript talking to a FastAPI backend on Postgres");
        assertEquals(Set.of("react", "frontend", "typescript", "python", "backend", "sql"), tags);
    }

    @Test
    void matchesWholeWordsOnly() {
        assertFalse(classifier.classify("FastAPI").contains("backend"));
        assertFalse(classifier.classify("javascript").contains("java"));
        assertTrue(classifier.classify("let's go to the store").isEmpty());
    }

    @Test
    void isCaseInsensitive() {
        assertEquals(Set.of("cloud"), classifier.classify("KUBERNETES"));
    }

    @Test
    void blankTextHasNoTags() {
        assertTrue(classifier.classify(null).isEmpty());
        assertTrue(classifier.classify("   ").isEmpty());
    }

    @Test
    void returnsTagsInSortedOrder() {
        var tags = classifier.classify("python and java");
        assertEquals("java", tags.iterator().next());
    }

    @Test
    void knownTagsCoverDefaultTable() {
        assertTrue(classifier.knownTags().containsAll(Set.of("python", "golang", "security", "data")));
    }
}
