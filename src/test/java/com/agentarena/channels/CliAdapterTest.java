package com.agentarena.channels;

import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class CliAdapterTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private CliAdapter adapter(String input) {
        return new CliAdapter(new BufferedReader(new StringReader(input)), new PrintStream(buffer, true));
    }

    @Test
    void forwardsNonBlankLinesUntilQuit() {
        var received = new ArrayList<String>();
        var stopped = new AtomicBoolean();
        var cli = adapter("/discover\n\n  /search x  \n/quit\n/never\n");
        cli.onStop(() -> stopped.set(true));

        cli.runLoop(received::add);

        assertEquals(List.of("/discover", "/search x"), received);
        assertTrue(stopped.get());
    }

    @Test
    void stopsOnEndOfInput() {
        var stopped = new AtomicBoolean();
        var cli = adapter("/help");
        cli.onStop(() -> stopped.set(true));

        cli.runLoop(line -> { });

        assertTrue(stopped.get());
        assertTrue(buffer.toString().contains("Agent Arena CLI"));
    }

    @Test
    void commandFailureIsPrintedAndLoopContinues() {
        var received = new ArrayList<String>();
        var cli = adapter("/boom\n/ok\n/exit\n");

        cli.runLoop(line -> {
            if (line.equals("/boom")) throw new IllegalStateException("exploded");
            received.add(line);
        });

        assertTrue(buffer.toString().contains("Command error: exploded"));
        assertEquals(List.of("/ok"), received);
    }

    @Test
    void sendPrintsLine() {
        adapter("").send("hello");
        assertTrue(buffer.toString().contains("hello"));
    }
}
