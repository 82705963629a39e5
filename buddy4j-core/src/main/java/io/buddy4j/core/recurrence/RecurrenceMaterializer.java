package io.buddy4j.core.recurrence;

import io.buddy4j.core.Milestone;
import io.buddy4j.core.Task;
import io.buddy4j.core.TaskPatch;
import io.buddy4j.core.TaskStatus;
import io.buddy4j.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns due occurrences of completed recurring tasks into new pending tasks.
 *
 * <p>Only the origin of a series (a task with {@code recurrenceOf == null}) materializes. An occurrence
 * is claimed by moving the origin's {@code nextOccurrence} forward with a conditional update; whoever
 * wins that update creates the instance, everyone else backs off.
 *
 * <p>A series that fell behind is caught up in one claim: occurrences missed while nobody materialized
 * them are skipped, the instance is due at the latest missed one, and the origin moves past now.
 */
public class RecurrenceMaterializer {

    private static final Logger log = LoggerFactory.getLogger(RecurrenceMaterializer.class);

    private final TaskStore store;
    private final Clock clock;

    public RecurrenceMaterializer(TaskStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Optional<Instant> nextOccurrence(Task task) {
        Objects.requireNonNull(task, "task must not be null");
        return Optional.ofNullable(task.computeNextOccurrence());
    }

    public boolean isDue(Task task) {
        return task.getStatus() == TaskStatus.COMPLETED
                && task.isRecurringOrigin()
                && task.getNextOccurrence() != null
                && !task.getNextOccurrence().isAfter(clock.instant());
    }

    public Optional<Task> materialize(Task task) {
        Objects.requireNonNull(task, "task must not be null");
        if (!isDue(task)) {
            return Optional.empty();
        }
        Instant observed = task.getNextOccurrence();
        Instant now = clock.instant();
        Instant occurrence = observed;
        Instant following = task.getRecurrence().nextAfter(occurrence);
        int skipped = 0;
        while (!following.isAfter(now)) {
            occurrence = following;
            following = task.getRecurrence().nextAfter(occurrence);
            skipped++;
        }

        Instant claimedNext = following;
        boolean claimed = store.updateIf(
                task.getId(),
                current -> current.getStatus() == TaskStatus.COMPLETED && observed.equals(current.getNextOccurrence()),
                TaskPatch.builder().nextOccurrence(claimedNext).build()
        );
        if (!claimed) {
            log.debug("Occurrence already claimed taskId={} occurrence={}", task.getId(), observed);
            return Optional.empty();
        }
        if (skipped > 0) {
            log.info("Skipped missed occurrences taskId={} skipped={} occurrence={}", task.getId(), skipped, occurrence);
        }

        Task instance = new Task(task.getTitle());
        instance.setDescription(task.getDescription());
        instance.setPriority(task.getPriority());
        instance.setAssignedHandler(task.getAssignedHandler());
        instance.setEstimatedHours(task.getEstimatedHours());
        instance.setTags(task.getTags());
        instance.setMilestones(task.getMilestones().stream().map(Milestone::reset).toList());
        instance.setRecurrence(task.getRecurrence());
        instance.setDueDate(occurrence);
        instance.setRecurrenceOf(task.getId());

        Task created = store.create(instance);
        log.info("Materialized recurring task originId={} taskId={} dueDate={}", task.getId(), created.getId(), occurrence);
        return Optional.of(created);
    }
}
