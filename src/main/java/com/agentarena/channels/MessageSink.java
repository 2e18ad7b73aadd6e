package com.agentarena.channels;

@FunctionalInterface
public interface MessageSink {
    void accept(String input);
}
