package com.agentarena.achievements;

import com.agentarena.shared.model.EventKind;
import com.agentarena.shared.model.Outcome;
import com.agentarena.shared.model.XpEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefaultAchievementsTest {

    private static XpEvent usage(long id, Outcome outcome, Long durationMillis) {
        return new XpEvent(id, "alpha", Instant.EPOCH.plusSeconds(id), "t", outcome, 1, 0, EventKind.USAGE,
                null, durationMillis);
    }

    @Test
    void catalogueKeysAreUnique() {
        var keys = new HashSet<String>();
        DefaultAchievements.catalogue().forEach(a -> assertTrue(keys.add(a.key()), a.key()));
        assertEquals(9, keys.size());
    }

    @Test
    void comebackNeedsThreeFailuresInARowThenSuccess() {
        assertFalse(DefaultAchievements.hasComeback(List.of(
                usage(1, Outcome.FAILURE, null), usage(2, Outcome.FAILURE, null), usage(3, Outcome.SUCCESS, null))));
        assertTrue(DefaultAchievements.hasComeback(List.of(
                usage(1, Outcome.FAILURE, null), usage(2, Outcome.FAILURE, null),
                usage(3, Outcome.FAILURE, null), usage(4, Outcome.SUCCESS, null))));
    }

    @Test
    void speedCountsOnlyFastSuccesses() {
        var history = new ArrayList<XpEvent>();
        history.add(usage(1, Outcome.SUCCESS, 59_999L));
        history.add(usage(2, Outcome.SUCCESS, 60_000L));
        history.add(usage(3, Outcome.FAILURE, 1_000L));
        history.add(usage(4, Outcome.SUCCESS, null));
        assertEquals(1, DefaultAchievements.fastSuccesses(history));
    }
}
