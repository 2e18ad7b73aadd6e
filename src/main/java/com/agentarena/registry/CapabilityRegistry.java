package com.agentarena.registry;

import com.agentarena.observability.MetricsConfig;
import com.agentarena.shared.model.CapabilityDescriptor;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Aggregates descriptors from several search roots. Roots are given lowest priority first;
 * a capability found in a later root replaces one of the same name from an earlier root.
 *
 * <p>The last scan is cached for a fixed TTL. Any call after expiry re-scans everything.
 */
public class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final List<Path> roots;
    private final Duration ttl;
    private final DescriptorLoader loader;
    private final Clock clock;
    private final MetricsConfig metrics;
    private final Set<String> everSeen = new HashSet<>();

    private DiscoveryResult cached;
    private Instant cachedAt;

    public CapabilityRegistry(List<Path> roots, Duration ttl, DescriptorLoader loader,
                              Clock clock, MetricsConfig metrics) {
        this.roots = List.copyOf(roots);
        this.ttl = ttl;
        this.loader = loader;
        this.clock = clock;
        this.metrics = metrics;
    }

    public CapabilityRegistry(List<Path> roots, Duration ttl, DescriptorLoader loader) {
        this(roots, ttl, loader, Clock.systemUTC(), new MetricsConfig());
    }

    public List<Path> roots() {
        return roots;
    }

    public DiscoveryResult discover() {
        return discover(false);
    }

    public synchronized DiscoveryResult discover(boolean forceRefresh) {
        if (!forceRefresh && isCacheValid()) {
            return cached;
        }
        cached = discover(roots);
        cachedAt = clock.instant();
        return cached;
    }

    /**
     * Cold scan of the given roots, bypassing the cache.
     */
    public DiscoveryResult discover(List<Path> orderedRoots) {
        var sample = Timer.start(metrics.registry());
        var byName = new LinkedHashMap<String, CapabilityDescriptor>();
        var warnings = new ArrayList<ParseFailure>();

        for (var root : orderedRoots) {
            var scan = loader.loadFrom(root);
            warnings.addAll(scan.failures());
            var seenInRoot = new HashSet<String>();
            for (var d : scan.descriptors()) {
                if (!seenInRoot.add(d.name())) {
                    var first = byName.get(d.name());
                    var failure = new ParseFailure(d.sourceFile(), ParseFailure.Kind.DUPLICATE_KEY,
                        "capability name '" + d.name() + "' already defined in " + (first != null ? first.sourceFile() : root));
                    log.warn("Skipping descriptor {}", failure);
                    warnings.add(failure);
                    continue;
                }
                var previous = byName.put(d.name(), d);
                if (previous != null) {
                    log.debug("Capability '{}' from {} overrides {}", d.name(), root, previous.sourceRoot());
                }
            }
        }

        var index = new RegistryIndex(byName.values(), clock.instant());
        synchronized (everSeen) {
            everSeen.addAll(byName.keySet());
        }
        sample.stop(metrics.scanDuration());
        metrics.registryScans().increment();
        metrics.parseFailures().increment(warnings.size());
        log.info("Discovered {} capabilities from {} search roots ({} warnings)",
            index.size(), orderedRoots.size(), warnings.size());
        return new DiscoveryResult(index, warnings);
    }

    /** Drops the cached index; the next {@link #discover()} re-scans. */
    public synchronized void invalidate() {
        cached = null;
        cachedAt = null;
    }

    /**
     * Whether {@code name} appeared in any scan made by this registry.
     */
    public boolean hasEverSeen(String name) {
        synchronized (everSeen) {
            return everSeen.contains(name);
        }
    }

    private boolean isCacheValid() {
        if (cached == null || cachedAt == null) return false;
        return clock.instant().isBefore(cachedAt.plus(ttl));
    }
}
