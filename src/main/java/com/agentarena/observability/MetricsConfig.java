package com.agentarena.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig() {
        this(new SimpleMeterRegistry());
    }

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Timer scanDuration() {
        return Timer.builder("arena.registry.scan.duration").register(registry);
    }

    public Counter registryScans() {
        return Counter.builder("arena.registry.scans").register(registry);
    }

    public Counter parseFailures() {
        return Counter.builder("arena.registry.parse.failures").register(registry);
    }

    public Counter eventsRecorded() {
        return Counter.builder("arena.events.recorded").register(registry);
    }

    public Counter achievementsUnlocked() {
        return Counter.builder("arena.achievements.unlocked").register(registry);
    }

    public Counter predicateFailures() {
        return Counter.builder("arena.predicate.failures").register(registry);
    }
}
