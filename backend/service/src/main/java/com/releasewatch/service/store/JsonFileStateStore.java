package com.releasewatch.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.releasewatch.core.model.StateRecord;
import com.releasewatch.core.state.PersistenceException;
import com.releasewatch.core.state.StateStore;
import com.releasewatch.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * All records in one JSON document. Every write replaces the whole file through a temporary
 * sibling and an atomic rename, so readers never see a torn file.
 *
 * <p>Writers hold an exclusive lock on {@code <file>.lock} and merge into what is on disk at that
 * moment, so another process sharing the file (a {@code --reset}, a second watcher) is never
 * overwritten with a stale in-memory copy. Reads re-load the file whenever it was replaced.
 */
public class JsonFileStateStore implements StateStore {
    private static final Logger LOGGER = Logger.getLogger(JsonFileStateStore.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    // FileChannel locks are per JVM, so instances on the same file share one in-process lock.
    private static final Map<Path, ReentrantLock> LOCKS = new ConcurrentHashMap<>();

    private final Path file;
    private final Path lockFile;
    private final ReentrantLock lock;
    private volatile Map<String, StateRecord> records = Map.of();
    private volatile FileStamp stamp;

    public JsonFileStateStore(Path file) {
        this.file = file;
        this.lockFile = file.resolveSibling(file.getFileName() + ".lock");
        this.lock = LOCKS.computeIfAbsent(file.toAbsolutePath().normalize(), path -> new ReentrantLock());
        lock.lock();
        try {
            reload();
        } finally {
            lock.unlock();
        }
        LOGGER.fine(() -> "Loaded " + records.size() + " state records from " + file);
    }

    @Override
    public Optional<StateRecord> get(String entityKey) {
        refreshIfReplaced();
        return Optional.ofNullable(records.get(entityKey));
    }

    @Override
    public void put(StateRecord record) {
        underFileLock(() -> {
            Map<String, StateRecord> next = readFile();
            next.put(record.entityKey(), record);
            write(next);
            reload();
        });
    }

    @Override
    public void reset() {
        underFileLock(() -> {
            write(Map.of());
            reload();
        });
        LOGGER.info(() -> "Cleared all state in " + file);
    }

    @Override
    public Set<String> keys() {
        refreshIfReplaced();
        return Set.copyOf(records.keySet());
    }

    private void underFileLock(Runnable action) {
        lock.lock();
        try {
            Files.createDirectories(lockFile.toAbsolutePath().getParent());
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock held = channel.lock()) {
                action.run();
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed writing state to " + file + " (lock " + lockFile + ")", e);
        } finally {
            lock.unlock();
        }
    }

    private void refreshIfReplaced() {
        if (Objects.equals(FileStamp.of(file), stamp)) {
            return;
        }
        lock.lock();
        try {
            reload();
        } finally {
            lock.unlock();
        }
    }

    // Stamp first: a file replaced mid-read only causes one more reload later.
    private void reload() {
        FileStamp current = FileStamp.of(file);
        records = Map.copyOf(readFile());
        stamp = current;
    }

    private Map<String, StateRecord> readFile() {
        Map<String, StateRecord> loaded = new TreeMap<>();
        if (!Files.exists(file)) {
            return loaded;
        }
        try (InputStream in = Files.newInputStream(file)) {
            StateFile state = MAPPER.readValue(in, StateFile.class);
            if (state.records() != null) {
                loaded.putAll(state.records());
            }
            return loaded;
        } catch (IOException e) {
            throw new PersistenceException("Failed loading state from " + file, e);
        }
    }

    private void write(Map<String, StateRecord> snapshot) {
        Path temp = null;
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, new StateFile(new TreeMap<>(snapshot)));
            }
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
        } catch (IOException e) {
            throw new PersistenceException("Failed writing state to " + file, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOGGER.warning(() -> "Could not remove temporary state file " + temp + ": " + e.getMessage());
        }
    }

    record StateFile(Map<String, StateRecord> records) {
    }

    /** Identity of one version of the file; an atomic rename always yields a new file key. */
    private record FileStamp(FileTime modified, long size, Object fileKey) {
        static FileStamp of(Path file) {
            if (!Files.exists(file)) {
                return null;
            }
            try {
                BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
                return new FileStamp(attributes.lastModifiedTime(), attributes.size(), attributes.fileKey());
            } catch (NoSuchFileException e) {
                return null;
            } catch (IOException e) {
                throw new PersistenceException("Failed loading state from " + file, e);
            }
        }
    }
}
