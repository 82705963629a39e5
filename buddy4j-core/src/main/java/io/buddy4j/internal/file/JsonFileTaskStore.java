package io.buddy4j.internal.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.buddy4j.core.PriorityScorer;
import io.buddy4j.core.StorageUnavailableException;
import io.buddy4j.core.Task;
import io.buddy4j.core.TaskValidationException;
import io.buddy4j.store.AbstractTaskStore;
import io.buddy4j.store.TaskSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Task store kept in memory and mirrored to one JSON document on disk.
 *
 * <p>Every write rewrites the document through a temp file and an atomic move while holding the write
 * lock. If the rewrite fails the in-memory change is rolled back, so memory never runs ahead of disk.
 */
public class JsonFileTaskStore extends AbstractTaskStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileTaskStore.class);

    private final Path path;
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicBoolean opened = new AtomicBoolean(false);

    public JsonFileTaskStore(Path path, ObjectMapper objectMapper, Clock clock, PriorityScorer scorer) {
        super(objectMapper, clock, scorer);
        this.path = Objects.requireNonNull(path, "path must not be null");
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void open() {
        lock.writeLock().lock();
        try {
            if (opened.get()) {
                return;
            }
            tasks.clear();
            if (Files.exists(path)) {
                if (!Files.isReadable(path)) {
                    throw new StorageUnavailableException("Task file is not readable: " + path);
                }
                TaskSnapshot snapshot = readSnapshot(path);
                try {
                    for (Task task : normalizeSnapshot(snapshot)) {
                        tasks.put(task.getId(), task);
                    }
                } catch (TaskValidationException e) {
                    tasks.clear();
                    throw new StorageUnavailableException("Task file is inconsistent: " + path, e);
                }
                log.info("Loaded task file path={} count={}", path, tasks.size());
            } else {
                writeSnapshot(path, TaskSnapshot.of(List.of()));
                log.info("Created task file path={}", path);
            }
            opened.set(true);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        opened.set(false);
    }

    @Override
    protected Optional<Task> find(String id) {
        ensureOpen();
        lock.readLock().lock();
        try {
            Task task = tasks.get(id);
            return task == null ? Optional.empty() : Optional.of(task.copy());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    protected List<Task> findAll() {
        ensureOpen();
        lock.readLock().lock();
        try {
            List<Task> copies = new ArrayList<>(tasks.size());
            tasks.values().forEach(t -> copies.add(t.copy()));
            return copies;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    protected void insert(Task task) {
        ensureOpen();
        lock.writeLock().lock();
        try {
            if (tasks.containsKey(task.getId())) {
                throw new IllegalStateException("Task id already exists: " + task.getId());
            }
            tasks.put(task.getId(), task.copy());
            try {
                flush();
            } catch (StorageUnavailableException e) {
                tasks.remove(task.getId());
                throw e;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    protected boolean replace(Task task, long expectedRevision) {
        ensureOpen();
        lock.writeLock().lock();
        try {
            Task stored = tasks.get(task.getId());
            if (stored == null || stored.getRevision() != expectedRevision) {
                return false;
            }
            tasks.put(task.getId(), task.copy());
            try {
                flush();
            } catch (StorageUnavailableException e) {
                tasks.put(stored.getId(), stored);
                throw e;
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    protected boolean remove(String id) {
        ensureOpen();
        lock.writeLock().lock();
        try {
            Task removed = tasks.remove(id);
            if (removed == null) {
                return false;
            }
            try {
                flush();
            } catch (StorageUnavailableException e) {
                tasks.put(id, removed);
                throw e;
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    protected void replaceAll(List<Task> replacement) {
        ensureOpen();
        lock.writeLock().lock();
        try {
            Map<String, Task> previous = new LinkedHashMap<>(tasks);
            tasks.clear();
            replacement.forEach(t -> tasks.put(t.getId(), t.copy()));
            try {
                flush();
            } catch (StorageUnavailableException e) {
                tasks.clear();
                tasks.putAll(previous);
                throw e;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    // caller holds the write lock
    private void flush() {
        writeSnapshot(path, TaskSnapshot.of(new ArrayList<>(tasks.values())));
    }

    private void ensureOpen() {
        if (!opened.get()) {
            throw new IllegalStateException("JsonFileTaskStore is not open: " + path);
        }
    }
}
