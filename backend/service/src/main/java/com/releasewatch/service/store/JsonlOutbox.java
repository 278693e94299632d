package com.releasewatch.service.store;

import com.releasewatch.core.model.WatchEvent;
import com.releasewatch.core.state.PersistenceException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Append-only JSON-lines log of queued and delivered events. An event is pending while it has
 * a queued line and no delivered line. Queued lines are synced before the state commit.
 *
 * <p>Reading the pending events also compacts the log down to their queued lines, through a
 * temporary sibling and an atomic rename.
 */
public class JsonlOutbox {
    private static final Logger LOGGER = Logger.getLogger(JsonlOutbox.class.getName());

    private final Path file;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlOutbox(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
    }

    public void enqueue(List<WatchEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        List<OutboxEntry> entries = new ArrayList<>();
        for (WatchEvent event : events) {
            entries.add(new EventQueued(clock.instant(), event));
        }
        append(entries);
    }

    public void markDelivered(String eventId, String channel) {
        append(List.of(new EventDelivered(clock.instant(), eventId, channel)));
    }

    /**
     * Queued events without a delivery record, in the order they were queued.
     */
    public List<WatchEvent> pending() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            Map<String, WatchEvent> pending = new LinkedHashMap<>();
            Map<String, String> queuedLines = new LinkedHashMap<>();
            int lineNumber = 0;
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                OutboxEntry entry;
                try {
                    entry = EventCodec.fromJsonLine(line);
                } catch (RuntimeException decodeError) {
                    throw new PersistenceException("Invalid outbox entry at line " + lineNumber + " of " + file, decodeError);
                }
                if (entry instanceof EventQueued queued) {
                    pending.putIfAbsent(queued.eventId(), queued.event());
                    queuedLines.putIfAbsent(queued.eventId(), line);
                } else {
                    pending.remove(entry.eventId());
                    queuedLines.remove(entry.eventId());
                }
            }
            if (lineNumber > queuedLines.size()) {
                compact(List.copyOf(queuedLines.values()), lineNumber);
            }
            return List.copyOf(pending.values());
        } catch (IOException e) {
            throw new PersistenceException("Failed reading outbox " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void compact(List<String> keptLines, int previousLines) throws IOException {
        Path temp = Files.createTempFile(file.toAbsolutePath().getParent(), file.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, keptLines, StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        LOGGER.fine(() -> "Compacted outbox " + file + " from " + previousLines + " to " + keptLines.size() + " lines");
    }

    private void append(List<OutboxEntry> entries) {
        lock.lock();
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND,
                    StandardOpenOption.DSYNC
            )) {
                for (OutboxEntry entry : entries) {
                    writer.write(EventCodec.toJsonLine(entry));
                    writer.newLine();
                }
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed appending to outbox " + file, e);
        } finally {
            lock.unlock();
        }
    }
}
