package com.agentarena.ledger;

import com.agentarena.shared.model.NewXpEvent;
import com.agentarena.shared.model.XpEvent;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Single JSON document holding every capability's raw events plus a cached summary per
 * capability. Each read-modify-write holds an exclusive lock on a sibling {@code .lock} file,
 * re-reads the document under that lock and replaces it with an atomic move, so concurrent
 * processes never lose each other's appends.
 *
 * <p>Reads always come from the raw events, grouped by each event's own capability name; the
 * cached summaries are only checked, never served. When the document fails its consistency
 * check the store marks itself corrupt and appends throw {@link CorruptLedgerException} until
 * {@link #rebuild()} succeeds. A document that cannot be parsed at all leaves the last parsed
 * events in place.
 */
public class JsonFileLedgerStore implements LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileLedgerStore.class);
    static final int FORMAT_VERSION = 1;

    private final Path file;
    private final Path lockFile;
    private final ProgressCalculator calculator;
    private final Clock clock;
    private final ObjectMapper mapper;

    private Map<String, List<XpEvent>> eventsByName = Map.of();
    private List<String> problems = List.of();

    public JsonFileLedgerStore(Path file, ProgressCalculator calculator) {
        this(file, calculator, Clock.systemUTC());
    }

    public JsonFileLedgerStore(Path file, ProgressCalculator calculator, Clock clock) {
        this.file = file;
        this.lockFile = file.resolveSibling(file.getFileName() + ".lock");
        this.calculator = calculator;
        this.clock = clock;
        this.mapper = new ObjectMapper().findAndRegisterModules()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);
        refresh();
    }

    public Path file() {
        return file;
    }

    public synchronized boolean isCorrupt() {
        return !problems.isEmpty();
    }

    @Override
    public synchronized XpEvent append(NewXpEvent e) {
        return withLock(() -> appendTo(readChecked(), e));
    }

    /** The duplicate check runs under the file lock, so concurrent processes unlock a key once. */
    @Override
    public synchronized XpEvent appendIfAbsent(NewXpEvent e) {
        if (e.achievementKey() == null) {
            throw new IllegalArgumentException("appendIfAbsent needs an achievement key for '" + e.capabilityName() + "'");
        }
        return withLock(() -> {
            var doc = readChecked();
            var current = group(doc);
            boolean present = current.getOrDefault(e.capabilityName(), List.of()).stream()
                .anyMatch(ev -> e.achievementKey().equals(ev.achievementKey()));
            if (present) {
                eventsByName = current;
                return null;
            }
            return appendTo(doc, e);
        });
    }

    @Override
    public synchronized List<XpEvent> readAll(String capabilityName) {
        if (capabilityName == null) return List.of();
        refresh();
        return eventsByName.getOrDefault(capabilityName, List.of());
    }

    @Override
    public synchronized List<XpEvent> readAll() {
        refresh();
        return eventsByName.values().stream()
            .flatMap(List::stream)
            .sorted(Comparator.comparingLong(XpEvent::eventId))
            .toList();
    }

    @Override
    public synchronized Set<String> capabilityNames() {
        refresh();
        return new TreeSet<>(eventsByName.keySet());
    }

    @Override
    public synchronized LedgerVerification verify() {
        refresh();
        int events = eventsByName.values().stream().mapToInt(List::size).sum();
        return new LedgerVerification(problems.isEmpty(), eventsByName.size(), events, problems);
    }

    /**
     * Recomputes every summary from the raw events. Events filed under the wrong capability move
     * to their own; duplicated ids are renumbered past the current maximum. No event is dropped.
     * A document that cannot be parsed at all is left untouched.
     */
    @Override
    public synchronized LedgerVerification rebuild() {
        return withLock(() -> {
            var doc = readOrThrow();
            var all = doc.capabilities().values().stream()
                .flatMap(c -> c.events().stream())
                .sorted(Comparator.comparingLong(XpEvent::eventId))
                .toList();

            long maxId = all.stream().mapToLong(XpEvent::eventId).max().orElse(0);
            long nextId = Math.max(maxId + 1, doc.nextEventId());
            var seen = new HashSet<Long>();
            var byName = new TreeMap<String, List<XpEvent>>();
            int renumbered = 0;
            for (var ev : all) {
                var fixed = ev;
                if (ev.eventId() < 1 || !seen.add(ev.eventId())) {
                    fixed = withId(ev, nextId++);
                    seen.add(fixed.eventId());
                    renumbered++;
                }
                byName.computeIfAbsent(fixed.capabilityName(), k -> new ArrayList<>()).add(fixed);
            }

            var capabilities = new TreeMap<String, CapabilityEntry>();
            byName.forEach((name, events) -> capabilities.put(name, new CapabilityEntry(events, summarize(name, events))));
            var rebuilt = new LedgerDocument(FORMAT_VERSION, nextId, capabilities);
            write(rebuilt);
            eventsByName = group(rebuilt);
            problems = List.of();
            log.info("Rebuilt ledger {}: {} capabilities, {} events, {} ids renumbered",
                file, capabilities.size(), all.size(), renumbered);
            return new LedgerVerification(true, capabilities.size(), all.size(), List.of());
        });
    }

    /**
     * Reloads from disk. A parseable document always replaces the read view, consistent or not;
     * an unreadable one keeps the previous view and records the problem.
     */
    private void refresh() {
        if (!Files.exists(file)) {
            eventsByName = Map.of();
            problems = List.of();
            return;
        }
        try {
            var doc = read();
            var found = check(doc);
            if (!found.isEmpty() && problems.isEmpty()) {
                log.warn("Ledger {} failed consistency check, serving raw events read-only: {}", file, found);
            }
            eventsByName = group(doc);
            problems = found;
        } catch (IOException e) {
            log.warn("Ledger {} unreadable, serving last parsed state: {}", file, e.getMessage());
            problems = List.of("unreadable: " + e.getMessage());
        }
    }

    private LedgerDocument readChecked() {
        var doc = readOrThrow();
        var found = check(doc);
        if (!found.isEmpty()) {
            problems = found;
            eventsByName = group(doc);
            log.error("Refusing append to {}: {}", file, found);
            throw new CorruptLedgerException(file.toString(), found);
        }
        return doc;
    }

    private XpEvent appendTo(LedgerDocument doc, NewXpEvent e) {
        var event = new XpEvent(doc.nextEventId(), e.capabilityName(), clock.instant(), e.taskLabel(),
            e.outcome(), e.baseXp(), e.bonusXp(), e.kind(), e.achievementKey(), e.durationMillis());

        var capabilities = new TreeMap<>(doc.capabilities());
        var existing = capabilities.get(e.capabilityName());
        var events = new ArrayList<XpEvent>(existing == null ? List.of() : existing.events());
        events.add(event);
        capabilities.put(e.capabilityName(), new CapabilityEntry(events, summarize(e.capabilityName(), events)));

        var updated = new LedgerDocument(FORMAT_VERSION, doc.nextEventId() + 1, capabilities);
        write(updated);
        eventsByName = group(updated);
        problems = List.of();
        return event;
    }

    /** Raw events keyed by the capability each event names, in {@code eventId} order. */
    private static Map<String, List<XpEvent>> group(LedgerDocument doc) {
        var byName = new TreeMap<String, List<XpEvent>>();
        doc.capabilities().forEach((filedUnder, entry) -> {
            for (var ev : entry.events()) {
                var owner = ev.capabilityName() != null ? ev.capabilityName() : filedUnder;
                byName.computeIfAbsent(owner, k -> new ArrayList<>()).add(ev);
            }
        });
        byName.replaceAll((name, events) -> events.stream()
            .sorted(Comparator.comparingLong(XpEvent::eventId))
            .toList());
        return byName;
    }

    private LedgerDocument readOrThrow() {
        try {
            return Files.exists(file) ? read() : LedgerDocument.empty();
        } catch (JsonProcessingException e) {
            problems = List.of("unparseable: " + e.getOriginalMessage());
            throw new CorruptLedgerException("Ledger " + file + " cannot be parsed; restore it from a backup", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read ledger: " + file, e);
        }
    }

    private LedgerDocument read() throws IOException {
        var doc = mapper.readValue(file.toFile(), LedgerDocument.class);
        return doc == null ? LedgerDocument.empty() : doc;
    }

    private void write(LedgerDocument doc) {
        var tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), doc);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write ledger: " + file, e);
        }
    }

    private <T> T withLock(Supplier<T> action) {
        try {
            var parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (var channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 var ignored = channel.lock()) {
                return action.get();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to lock ledger: " + lockFile, e);
        }
    }

    List<String> check(LedgerDocument doc) {
        var found = new ArrayList<String>();
        var ids = new HashSet<Long>();
        long maxId = 0;
        for (var entry : doc.capabilities().entrySet()) {
            var name = entry.getKey();
            long previous = 0;
            for (var ev : entry.getValue().events()) {
                if (!name.equals(ev.capabilityName())) {
                    found.add("event " + ev.eventId() + " filed under '" + name + "' belongs to '" + ev.capabilityName() + "'");
                }
                if (!ids.add(ev.eventId())) {
                    found.add("duplicate event id " + ev.eventId());
                }
                if (ev.eventId() <= previous) {
                    found.add("events of '" + name + "' out of order at id " + ev.eventId());
                }
                previous = ev.eventId();
                maxId = Math.max(maxId, ev.eventId());
            }
            var cached = entry.getValue().summary();
            if (cached != null) {
                var fresh = summarize(name, entry.getValue().events());
                if (!cached.equals(fresh)) {
                    found.add("summary of '" + name + "' is " + cached + " but events give " + fresh);
                }
            }
        }
        if (doc.nextEventId() <= maxId) {
            found.add("nextEventId " + doc.nextEventId() + " is not above highest id " + maxId);
        }
        return found;
    }

    private Summary summarize(String name, List<XpEvent> events) {
        var p = calculator.fold(name, events);
        return new Summary(p.totalXp(), p.level(), p.eventCount(), p.successCount(),
            List.copyOf(p.unlockedAchievements()));
    }

    private static XpEvent withId(XpEvent e, long id) {
        return new XpEvent(id, e.capabilityName(), e.timestamp(), e.taskLabel(), e.outcome(),
            e.baseXp(), e.bonusXp(), e.kind(), e.achievementKey(), e.durationMillis());
    }

    record LedgerDocument(int version, long nextEventId, Map<String, CapabilityEntry> capabilities) {
        LedgerDocument {
            if (nextEventId < 1) nextEventId = 1;
            capabilities = capabilities == null ? Map.of() : new TreeMap<>(capabilities);
        }

        static LedgerDocument empty() {
            return new LedgerDocument(FORMAT_VERSION, 1, Map.of());
        }
    }

    record CapabilityEntry(List<XpEvent> events, Summary summary) {
        CapabilityEntry {
            events = events == null ? List.of() : List.copyOf(events);
        }
    }

    record Summary(long totalXp, int level, int eventCount, int successCount, List<String> unlockedAchievements) {
        Summary {
            unlockedAchievements = unlockedAchievements == null ? List.of() : List.copyOf(unlockedAchievements);
        }
    }
}
