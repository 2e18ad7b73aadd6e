package com.agentarena.channels;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

public class CliAdapter {

    private final BufferedReader reader;
    private final PrintStream out;
    private volatile boolean running;
    private Thread readThread;
    private Runnable onStop;

    public CliAdapter(BufferedReader reader, PrintStream out) {
        this.reader = reader;
        this.out = out;
    }

    public void onStop(Runnable callback) {
        this.onStop = callback;
    }

    public void start(MessageSink sink) {
        readThread = new Thread(() -> runLoop(sink), "arena-cli");
        readThread.setDaemon(true);
        readThread.start();
    }

    void runLoop(MessageSink sink) {
        running = true;
        out.println("Agent Arena CLI (type /help for commands, /quit to stop)");
        while (running) {
            out.print("> ");
            out.flush();
            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                if (!running) break;
                var msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                out.println("Input read error: " + msg);
                continue;
            }

            if (line == null) {
                finish();
                break;
            }
            var input = line.trim();
            if (input.isEmpty()) continue;
            if ("/quit".equals(input) || "/exit".equals(input)) {
                finish();
                break;
            }

            try {
                sink.accept(input);
            } catch (RuntimeException e) {
                var msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                out.println("Command error: " + msg);
            }
        }
    }

    public void send(String text) {
        out.println(text);
    }

    public void stop() {
        running = false;
        if (readThread != null) readThread.interrupt();
    }

    private void finish() {
        stop();
        if (onStop != null) onStop.run();
    }
}
