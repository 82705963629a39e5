package io.buddy4j.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.buddy4j.core.ConcurrentTaskUpdateException;
import io.buddy4j.core.DependencyCycleException;
import io.buddy4j.core.PriorityScorer;
import io.buddy4j.core.Recurrence;
import io.buddy4j.core.StorageUnavailableException;
import io.buddy4j.core.Task;
import io.buddy4j.core.TaskFilter;
import io.buddy4j.core.TaskPatch;
import io.buddy4j.core.TaskStatus;
import io.buddy4j.core.TaskValidationException;
import io.buddy4j.core.graph.DependencyGraphValidator;
import io.buddy4j.core.graph.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

/**
 * Task store invariants shared by every backend.
 *
 * <p>Backends implement a handful of record-level primitives; this class layers validation, parent and
 * subtask linking, cascade deletes, score maintenance and optimistic concurrency on top. Each update
 * loads the current record, applies the change to a copy, and writes it back only if the stored
 * revision is still the one that was read, retrying on conflict.
 *
 * <p>Revision checks cover one record, but a cycle spans several. Writes that change dependencies are
 * therefore serialized on a store-wide lock, and the stored graph is checked again after the write;
 * a writer in another process that closed a cycle in between gets its new edges rolled back.
 */
public abstract class AbstractTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(AbstractTaskStore.class);

    static final int MAX_WRITE_ATTEMPTS = 10;

    protected final ObjectMapper objectMapper;
    protected final Clock clock;
    private final PriorityScorer scorer;
    private final DependencyGraphValidator validator;
    private final ReentrantLock graphLock = new ReentrantLock();

    protected AbstractTaskStore(ObjectMapper objectMapper, Clock clock, PriorityScorer scorer) {
        this.objectMapper = TaskJson.mapper(Objects.requireNonNull(objectMapper, "objectMapper must not be null"));
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.validator = new DependencyGraphValidator(this::find);
    }

    protected abstract Optional<Task> find(String id);

    protected abstract List<Task> findAll();

    protected abstract void insert(Task task);

    /**
     * Replaces the stored task with the same id if its revision still equals {@code expectedRevision}.
     *
     * @return false on a revision mismatch or when the task is gone
     */
    protected abstract boolean replace(Task task, long expectedRevision);

    protected abstract boolean remove(String id);

    protected abstract void replaceAll(List<Task> tasks);

    protected List<Task> query(TaskFilter filter) {
        return findAll().stream().filter(filter::matches).toList();
    }

    @Override
    public Task create(Task draft) {
        Objects.requireNonNull(draft, "draft must not be null");
        Task task = draft.copy();
        if (task.getTitle() == null || task.getTitle().isBlank()) {
            throw new TaskValidationException("title must not be blank");
        }
        if (task.getId() == null || task.getId().isBlank()) {
            task.setId(UUID.randomUUID().toString());
        } else if (find(task.getId()).isPresent()) {
            throw new TaskValidationException("Task id already exists: " + task.getId());
        }
        if (task.getProgress() < 0 || task.getProgress() > 100) {
            throw new TaskValidationException("progress must be within 0..100: " + task.getProgress());
        }
        if (task.getEstimatedHours() != null && task.getEstimatedHours() < 0) {
            throw new TaskValidationException("estimatedHours must not be negative: " + task.getEstimatedHours());
        }
        if (task.getPriority() == null) {
            throw new TaskValidationException("priority must not be null");
        }
        if (task.getDescription() == null) {
            task.setDescription("");
        }
        if (task.getParentId() != null && find(task.getParentId()).isEmpty()) {
            throw new TaskValidationException("Parent task not found: " + task.getParentId());
        }
        task.setStatus(task.getProgress() == 100 ? TaskStatus.COMPLETED : TaskStatus.PENDING);
        task.setSubtasks(Set.of());
        if (!task.getDependencies().isEmpty()) {
            checkDependencies(task);
        }

        Instant now = now();
        task.setCreatedAt(now);
        task.setUpdatedAt(now);
        task.setLastActivityAt(now);
        task.setNextOccurrence(task.computeNextOccurrence());
        task.setRevision(1);
        task.setDynamicPriorityScore(scorer.score(task));
        insert(task);
        log.debug("Created task id={} title={}", task.getId(), task.getTitle());

        if (task.getParentId() != null) {
            String childId = task.getId();
            boolean linked = mutate(task.getParentId(), p -> true, (current, next) -> next.getSubtasks().add(childId));
            if (!linked) {
                log.warn("Parent vanished while linking subtask parentId={} taskId={}", task.getParentId(), childId);
            }
        }
        return task.copy();
    }

    @Override
    public Optional<Task> get(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return find(id);
    }

    @Override
    public boolean updateIf(String id, Predicate<Task> condition, TaskPatch patch) {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(patch, "patch must not be null");
        if (!patch.touchesDependencies()) {
            return mutate(id, condition, (current, next) -> applyPatch(patch, current, next));
        }

        graphLock.lock();
        try {
            Set<String> added = new LinkedHashSet<>();
            boolean updated = mutate(id, condition, (current, next) -> {
                applyPatch(patch, current, next);
                added.clear();
                added.addAll(next.getDependencies());
                added.removeAll(current.getDependencies());
                if (!current.getDependencies().equals(next.getDependencies())) {
                    checkDependencies(next);
                }
            });
            if (updated && !added.isEmpty()) {
                recheckCommittedEdges(id, added);
            }
            return updated;
        } finally {
            graphLock.unlock();
        }
    }

    private void applyPatch(TaskPatch patch, Task current, Task next) {
        patch.applyTo(next);
        if (patch.touchesWork()) {
            next.setLastActivityAt(now());
        }
    }

    /**
     * Validates the stored graph after new edges landed and takes them back out if another writer
     * closed a cycle through them in the meantime.
     */
    private void recheckCommittedEdges(String id, Set<String> added) {
        ValidationResult result = validator.validate(id);
        if (!result.cycleDetected()) {
            return;
        }
        log.warn("Concurrent dependency write closed a cycle, rolling back taskId={} edges={}", id, added);
        mutate(id, t -> true, (current, next) -> next.getDependencies().removeAll(added));
        throw new DependencyCycleException(result.errors());
    }

    @Override
    public boolean delete(String id) {
        Objects.requireNonNull(id, "id must not be null");
        if (find(id).isEmpty()) {
            return false;
        }

        Set<String> doomed = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>(List.of(id));
        while (!pending.isEmpty()) {
            String next = pending.pop();
            if (!doomed.add(next)) {
                continue;
            }
            find(next).ifPresent(t -> pending.addAll(t.getSubtasks()));
            query(TaskFilter.builder().parentId(next).build()).forEach(t -> pending.add(t.getId()));
        }

        List<String> order = new ArrayList<>(doomed);
        for (int i = order.size() - 1; i >= 0; i--) {
            remove(order.get(i));
        }

        for (Task other : findAll()) {
            boolean referencesDoomed = other.getDependencies().stream().anyMatch(doomed::contains)
                    || other.getSubtasks().stream().anyMatch(doomed::contains);
            if (referencesDoomed) {
                mutate(other.getId(), t -> true, (current, next) -> {
                    next.getDependencies().removeAll(doomed);
                    next.getSubtasks().removeAll(doomed);
                });
            }
        }
        log.debug("Deleted task id={} cascade={}", id, doomed.size());
        return true;
    }

    @Override
    public List<Task> list(TaskFilter filter) {
        Objects.requireNonNull(filter, "filter must not be null");
        return query(filter);
    }

    @Override
    public void backup(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        writeSnapshot(path, TaskSnapshot.of(findAll()));
        log.info("Wrote task backup path={}", path);
    }

    @Override
    public void restore(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        TaskSnapshot snapshot = readSnapshot(path);
        List<Task> tasks = normalizeSnapshot(snapshot);
        replaceAll(tasks);
        log.info("Restored tasks from backup path={} count={}", path, tasks.size());
    }

    protected void writeSnapshot(Path path, TaskSnapshot snapshot) {
        try {
            Path dir = path.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Path tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            try {
                objectMapper.writeValue(tmp.toFile(), snapshot);
                moveIntoPlace(tmp, path);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to write tasks to " + path, e);
        }
    }

    protected TaskSnapshot readSnapshot(Path path) {
        try {
            return objectMapper.readValue(path.toFile(), TaskSnapshot.class);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to read tasks from " + path, e);
        }
    }

    /**
     * Validates a snapshot and rebuilds the store-maintained fields (subtasks, scores).
     */
    protected List<Task> normalizeSnapshot(TaskSnapshot snapshot) {
        if (snapshot.version() != TaskSnapshot.CURRENT_VERSION) {
            throw new TaskValidationException("Unsupported task document version: " + snapshot.version());
        }
        Map<String, Task> byId = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        for (Task t : snapshot.tasks()) {
            if (t.getId() == null || t.getId().isBlank()) {
                errors.add("Task without id: " + t.getTitle());
                continue;
            }
            if (byId.putIfAbsent(t.getId(), t.copy()) != null) {
                errors.add("Duplicate task id: " + t.getId());
            }
            if (t.getTitle() == null || t.getTitle().isBlank()) {
                errors.add("Task " + t.getId() + " has a blank title");
            }
            if (t.getStatus() == null || t.getPriority() == null) {
                errors.add("Task " + t.getId() + " has no status or priority");
            }
            if (t.getProgress() < 0 || t.getProgress() > 100) {
                errors.add("Task " + t.getId() + " has progress outside 0..100");
            } else if (t.getProgress() == 100 && t.getStatus() != TaskStatus.COMPLETED) {
                errors.add("Task " + t.getId() + " is at 100% but not completed");
            }
        }
        for (Task t : byId.values()) {
            if (t.getParentId() != null && !byId.containsKey(t.getParentId())) {
                errors.add("Parent " + t.getParentId() + " of task " + t.getId() + " not found");
            }
        }
        if (errors.isEmpty()) {
            DependencyGraphValidator snapshotGraph =
                    new DependencyGraphValidator(id -> Optional.ofNullable(byId.get(id)));
            boolean cycle = false;
            Set<String> reported = new HashSet<>();
            for (String id : byId.keySet()) {
                ValidationResult result = snapshotGraph.validate(id);
                result.errors().stream().filter(reported::add).forEach(errors::add);
                cycle |= result.cycleDetected();
            }
            if (cycle) {
                throw new DependencyCycleException(errors);
            }
        }
        if (!errors.isEmpty()) {
            throw new TaskValidationException(errors);
        }

        for (Task t : byId.values()) {
            t.setSubtasks(Set.of());
            if (t.getRecurrence() == null) {
                t.setRecurrence(Recurrence.none());
            }
        }
        for (Task t : byId.values()) {
            if (t.getParentId() != null) {
                byId.get(t.getParentId()).getSubtasks().add(t.getId());
            }
        }
        for (Task t : byId.values()) {
            t.setDynamicPriorityScore(scorer.score(t));
        }
        return new ArrayList<>(byId.values());
    }

    /**
     * Read, change a copy, conditionally write back; repeated while other writers win the race.
     */
    private boolean mutate(String id, Predicate<Task> condition, BiConsumer<Task, Task> change) {
        Objects.requireNonNull(id, "id must not be null");
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            Optional<Task> loaded = find(id);
            if (loaded.isEmpty()) {
                return false;
            }
            Task current = loaded.get();
            if (!condition.test(current)) {
                return false;
            }
            Task next = current.copy();
            change.accept(current, next);
            next.setUpdatedAt(nextTimestamp(current.getUpdatedAt()));
            next.setDynamicPriorityScore(scorer.score(next));
            next.setRevision(current.getRevision() + 1);
            if (replace(next, current.getRevision())) {
                return true;
            }
            log.debug("Concurrent write detected taskId={} attempt={}", id, attempt);
        }
        throw new ConcurrentTaskUpdateException(id, MAX_WRITE_ATTEMPTS);
    }

    private void checkDependencies(Task candidate) {
        ValidationResult result = validator.validate(candidate);
        if (result.ok()) {
            return;
        }
        if (result.cycleDetected()) {
            throw new DependencyCycleException(result.errors());
        }
        throw new TaskValidationException(result.errors());
    }

    protected Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private Instant nextTimestamp(Instant previous) {
        Instant now = now();
        if (previous == null || now.isAfter(previous)) {
            return now;
        }
        return previous.plusMillis(1);
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
