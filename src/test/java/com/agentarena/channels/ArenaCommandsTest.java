package com.agentarena.channels;

import com.agentarena.ledger.InMemoryLedgerStore;
import com.agentarena.ledger.LevelTable;
import com.agentarena.ledger.ProgressCalculator;
import com.agentarena.observability.DoctorCommand;
import com.agentarena.observability.MetricsConfig;
import com.agentarena.progression.ProgressionFacade;
import com.agentarena.progression.XpPolicy;
import com.agentarena.shared.config.ArenaConfig;
import com.agentarena.shared.config.ProgressionConfig;
import com.agentarena.shared.config.RecommendationConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArenaCommandsTest {

    @TempDir
    Path tempDir;

    private ArenaCommands commands;

    @BeforeEach
    void setUp() throws IOException {
        var root = tempDir.resolve("agents");
        write(root.resolve("development/react-ui.md"), "react-ui", "React frontend components");
        write(root.resolve("security/auditor.md"), "auditor", "Security audits and OAuth reviews");

        var config = new ArenaConfig(List.of(root), Duration.ofMinutes(5), tempDir.resolve("ledger.json"),
                ProgressionConfig.defaults(), RecommendationConfig.defaults());
        var store = new InMemoryLedgerStore();
        var facade = ProgressionFacade.create(config, new MetricsConfig(), store,
                new ProgressCalculator(LevelTable.defaults()));
        commands = new ArenaCommands(facade, new DoctorCommand(config.searchRoots(), store), new XpPolicy());
    }

    private static void write(Path file, String name, String summary) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "---\nname: " + name + "\nsummary: " + summary + "\n---\n");
    }

    @Test
    void discoverCountsCapabilities() {
        assertEquals("Discovered 2 capabilities", commands.handle("/discover"));
        assertEquals("Discovered 2 capabilities", commands.handle("/discover --refresh"));
    }

    @Test
    void searchFiltersByCategory() {
        var out = commands.handle("/search category=security");
        assertTrue(out.startsWith("auditor"));
        assertFalse(out.contains("react-ui"));
        assertEquals("No capabilities match.", commands.handle("/search kubernetes"));
    }

    @Test
    void searchRejectsUnknownCategory() {
        assertEquals("Error: Unknown category: cooking", commands.handle("/search category=cooking"));
    }

    @Test
    void logRecordsEventAndReportsAchievement() {
        var out = commands.handle("/log react-ui success xp=10 build the page");

        assertTrue(out.startsWith("react-ui +10 XP -> 60 XP, level 1"), out);
        assertTrue(out.contains("Achievement unlocked:"));
    }

    @Test
    void logWithoutXpUsesPolicy() {
        var out = commands.handle("/log react-ui failure fix typo");
        assertTrue(out.startsWith("react-ui +3 XP -> 3 XP"), out);
    }

    @Test
    void logReportsLevelUp() {
        var out = commands.handle("/log react-ui success xp=100 ship it");
        assertTrue(out.contains("LEVEL UP: 1 -> 2"), out);
    }

    @Test
    void errorsAreReportedNotThrown() {
        assertTrue(commands.handle("/log ghost success xp=5 x").startsWith("Error: Unknown capability 'ghost'"));
        assertTrue(commands.handle("/log react-ui maybe").startsWith("Error: Unknown outcome"));
        assertTrue(commands.handle("/log").startsWith("Error: Usage"));
        assertEquals("Error: Invalid n: 'abc'", commands.handle("/leaderboard abc"));
    }

    @Test
    void progressAndLeaderboard() {
        assertEquals("No recorded activity yet.", commands.handle("/leaderboard"));
        commands.handle("/log auditor success xp=20 audit login");

        var progress = commands.handle("/progress auditor");
        assertTrue(progress.startsWith("auditor: level 1 Novice, 70 XP"), progress);
        assertTrue(progress.contains("uses 1, successes 1, failures 0"));

        var board = commands.handle("/leaderboard 5");
        assertTrue(board.contains(" 1. auditor"), board);
    }

    @Test
    void recommendPrintsSignatureAndSquad() {
        var out = commands.handle("/recommend Add OAuth login to the React dashboard");
        assertTrue(out.startsWith("Signature: "), out);
        assertTrue(out.contains("Squad"));
        assertTrue(commands.handle("/recommend").startsWith("Error: Usage"));
    }

    @Test
    void verifyRegistryDoctorAndHelp() {
        assertTrue(commands.handle("/verify").startsWith("[OK] Ledger consistent"));
        assertTrue(commands.handle("/registry").contains("Capabilities: 2"));
        assertTrue(commands.handle("/doctor").contains("[OK] Java"));
        assertEquals(ArenaCommands.HELP, commands.handle("/help"));
        assertEquals("Unknown command: /dance (try /help)", commands.handle("/dance"));
    }
}
