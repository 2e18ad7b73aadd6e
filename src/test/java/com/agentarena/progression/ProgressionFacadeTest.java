package com.agentarena.progression;

import com.agentarena.ledger.InMemoryLedgerStore;
import com.agentarena.ledger.LevelTable;
import com.agentarena.ledger.ProgressCalculator;
import com.agentarena.ledger.UnknownCapabilityException;
import com.agentarena.observability.MetricsConfig;
import com.agentarena.recommend.WorkEstimator;
import com.agentarena.registry.SearchFilter;
import com.agentarena.shared.config.ArenaConfig;
import com.agentarena.shared.config.ProgressionConfig;
import com.agentarena.shared.config.RecommendationConfig;
import com.agentarena.shared.model.Category;
import com.agentarena.shared.model.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ProgressionFacadeTest {

    @TempDir
    Path tempDir;

    private final MetricsConfig metrics = new MetricsConfig();
    private final List<ProgressionNotification> notifications = new ArrayList<>();
    private ArenaConfig config;
    private ProgressCalculator calculator;
    private ProgressionFacade facade;

    @BeforeEach
    void setUp() throws IOException {
        var root = tempDir.resolve("agents");
        agent(root, "development/python-backend.md", "python-backend", "Python backend services with FastAPI");
        agent(root, "development/react-ui.md", "react-ui", "React frontend components");
        agent(root, "quality/test-engineer.md", "test-engineer", "Writes pytest suites");

        config = new ArenaConfig(List.of(root), Duration.ofMinutes(5), tempDir.resolve("ledger.json"),
                ProgressionConfig.defaults(), RecommendationConfig.defaults());
        calculator = new ProgressCalculator(LevelTable.from(config.progression()));
        facade = ProgressionFacade.create(config, metrics, new InMemoryLedgerStore(new TickingClock()), calculator);
        facade.addListener(notifications::add);
    }

    private static void agent(Path root, String relative, String name, String summary) throws IOException {
        var file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "---\nname: " + name + "\nsummary: " + summary + "\n---\n");
    }

    @Test
    void discoversAndSearches() {
        assertEquals(3, facade.discover().index().size());
        var found = facade.search(SearchFilter.all().withCategories(Set.of(Category.QUALITY)));
        assertEquals(List.of("test-engineer"), found.stream().map(d -> d.name()).toList());
    }

    @Test
    void recommendsTechMatchFirst() {
        var rec = facade.recommend("Build a Python FastAPI backend with PostgreSQL");

        assertEquals("python-backend", rec.ranked().get(0).name());
        assertTrue(rec.ranked().get(0).score() > rec.ranked().get(1).score());
        assertEquals("python-backend", rec.squad().members().get(0).name());
        assertEquals(3, rec.squad().members().size());
    }

    @Test
    void recommendLimitTrimsRankingButNotSquad() {
        var rec = facade.recommend("Build a Python FastAPI backend with PostgreSQL", 1);
        assertEquals(1, rec.ranked().size());
        assertEquals(3, rec.squad().members().size());
        assertThrows(IllegalArgumentException.class, () -> facade.recommend("x", 0));
    }

    @Test
    void recordsWithoutPriorDiscoverCall() {
        var result = facade.recordEvent("python-backend", "build api", Outcome.SUCCESS, 10);

        assertEquals(List.of("first-success"), result.unlocked().stream().map(u -> u.key()).toList());
        assertEquals(60, result.progress().totalXp());
        assertEquals(1, result.progress().eventCount());
        assertFalse(result.leveledUp());
        assertEquals(List.of(NotificationType.XP_GAINED, NotificationType.ACHIEVEMENT_UNLOCKED),
                notifications.stream().map(ProgressionNotification::type).toList());
        assertEquals(10L, notifications.get(0).payload().get("xpGained"));
        assertEquals(60L, notifications.get(0).payload().get("totalXp"));
        assertEquals("first-success", notifications.get(1).payload().get("achievementKey"));
        assertEquals(1.0, metrics.eventsRecorded().count());
    }

    @Test
    void unknownCapabilityIsRejected() {
        assertThrows(UnknownCapabilityException.class,
                () -> facade.recordEvent("ghost", "x", Outcome.SUCCESS, 10));
        assertThrows(UnknownCapabilityException.class, () -> facade.getProgress("ghost"));
        assertTrue(notifications.isEmpty());
    }

    @Test
    void levelUpIsReportedAndNotified() {
        var result = facade.recordEvent("react-ui", "ship page", Outcome.SUCCESS, 100);

        assertEquals(1, result.previousLevel());
        assertEquals(2, result.progress().level());
        assertTrue(result.leveledUp());
        var last = notifications.get(notifications.size() - 1);
        assertEquals(NotificationType.LEVEL_UP, last.type());
        assertEquals(1, last.payload().get("previousLevel"));
        assertEquals(2, last.payload().get("level"));
    }

    @Test
    void failingListenerDoesNotBreakRecording() {
        facade.addListener(n -> {
            throw new IllegalStateException("dashboard down");
        });
        var result = facade.recordEvent("react-ui", "task", Outcome.FAILURE, 3);
        assertEquals(3, result.progress().totalXp());
        assertEquals(1, notifications.size());
    }

    @Test
    void leaderboardOrdersByXpThenEarliestStart() {
        facade.recordEvent("test-engineer", "suite", Outcome.SUCCESS, 10);
        facade.recordEvent("react-ui", "page", Outcome.SUCCESS, 10);
        facade.recordEvent("python-backend", "api", Outcome.SUCCESS, 200);

        var board = facade.leaderboard(10);

        assertEquals(List.of("python-backend", "test-engineer", "react-ui"),
                board.stream().map(e -> e.capabilityName()).toList());
        assertEquals(1, board.get(0).rank());
        assertEquals(250, board.get(0).totalXp());
        assertEquals(1, board.get(0).achievementCount());
        assertEquals(2, facade.leaderboard(2).size());
        assertThrows(IllegalArgumentException.class, () -> facade.leaderboard(0));
    }

    @Test
    void levelProgressAndStanding() {
        facade.recordEvent("react-ui", "page", Outcome.SUCCESS, 100);
        var lp = facade.levelProgress("react-ui");
        assertEquals(2, lp.level());
        assertEquals(50, lp.xpIntoLevel());

        var standing = facade.standingOf("react-ui");
        assertTrue(standing.hasHistory());
        assertEquals(1.0, standing.successRate());
        assertFalse(facade.standingOf("python-backend").hasHistory());
    }

    @Test
    void historyRaisesRankingOfEqualCapabilities() {
        facade.recordEvent("react-ui", "page", Outcome.FAILURE, 1);
        var rec = facade.recommend("something generic");
        var names = rec.ranked().stream().map(s -> s.name()).toList();
        assertTrue(names.indexOf("python-backend") < names.indexOf("react-ui"));
    }

    @Test
    void recommendationCarriesWorkEstimate() {
        var rec = facade.recommend("Build a Python FastAPI backend with PostgreSQL");

        assertEquals(new WorkEstimator().estimate(rec.signature()), rec.estimate());
        assertTrue(rec.estimate().estimatedHours() > 0);
        assertFalse(rec.estimate().taskBreakdown().isEmpty());
    }

    @Test
    void rankingReadsTheLedgerOnce() {
        var store = spy(new InMemoryLedgerStore(new TickingClock()));
        var counted = ProgressionFacade.create(config, metrics, store, calculator);
        counted.recordEvent("react-ui", "page", Outcome.SUCCESS, 10);
        counted.recordEvent("python-backend", "api", Outcome.FAILURE, 3);
        clearInvocations(store);

        var rec = counted.recommend("Build a Python FastAPI backend with PostgreSQL");

        assertEquals(3, rec.ranked().size());
        verify(store, times(1)).readAll();
        verify(store, never()).readAll(anyString());
    }

    @Test
    void missingNameIsRejected() {
        var ex = assertThrows(IllegalArgumentException.class,
                () -> facade.recordEvent(null, "x", Outcome.SUCCESS, 10));
        assertEquals("capabilityName is required", ex.getMessage());
        assertThrows(IllegalArgumentException.class, () -> facade.recordEvent(" ", "x", Outcome.SUCCESS, 10));
        assertThrows(IllegalArgumentException.class, () -> facade.getProgress(null));
        assertThrows(IllegalArgumentException.class, () -> facade.levelProgress(null));
        assertTrue(notifications.isEmpty());
    }

    @Test
    void verifyAndRebuildDelegateToStore() {
        facade.recordEvent("react-ui", "page", Outcome.SUCCESS, 5);
        assertTrue(facade.verifyLedger().healthy());
        assertEquals(2, facade.rebuildLedger().events());
    }

    static final class TickingClock extends Clock {
        private Instant next = Instant.parse("2026-01-01T00:00:00Z");

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public synchronized Instant instant() {
            var now = next;
            next = next.plusSeconds(1);
            return now;
        }
    }
}
