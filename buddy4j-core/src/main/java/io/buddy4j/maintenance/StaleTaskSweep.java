package io.buddy4j.maintenance;

import io.buddy4j.core.Notification;
import io.buddy4j.core.NotificationLevel;
import io.buddy4j.core.Task;
import io.buddy4j.core.TaskFilter;
import io.buddy4j.core.TaskPatch;
import io.buddy4j.core.TaskStatus;
import io.buddy4j.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Flags in-progress tasks that have seen no work for longer than the threshold. A task is flagged once
 * per idle stretch; any work mutation starts a new stretch.
 */
public class StaleTaskSweep implements MaintenancePass {

    private static final Logger log = LoggerFactory.getLogger(StaleTaskSweep.class);

    private final TaskStore store;
    private final Clock clock;
    private final Duration threshold;

    public StaleTaskSweep(TaskStore store, Clock clock, Duration threshold) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.threshold = Objects.requireNonNull(threshold, "threshold must not be null");
    }

    @Override
    public String name() {
        return "stale-task-sweep";
    }

    @Override
    public int run() {
        int written = 0;
        Instant now = clock.instant();
        for (Task task : store.list(TaskFilter.builder().status(TaskStatus.IN_PROGRESS).build())) {
            if (!isStale(task, now)) {
                continue;
            }
            long idleDays = Duration.between(lastActivity(task), now).toDays();
            TaskPatch patch = TaskPatch.builder()
                    .notify(new Notification(
                            "Task '" + task.getTitle() + "' has been in progress without activity for "
                                    + idleDays + " days",
                            NotificationLevel.WARNING,
                            now))
                    .staleFlaggedAt(now)
                    .build();
            if (store.updateIf(task.getId(), current -> current.getStatus() == TaskStatus.IN_PROGRESS
                    && isStale(current, now), patch)) {
                written++;
                log.debug("Flagged stale task taskId={} idleDays={}", task.getId(), idleDays);
            }
        }
        return written;
    }

    private boolean isStale(Task task, Instant now) {
        Instant lastActivity = lastActivity(task);
        if (lastActivity == null || !lastActivity.plus(threshold).isBefore(now)) {
            return false;
        }
        return task.getStaleFlaggedAt() == null || task.getStaleFlaggedAt().isBefore(lastActivity);
    }

    private static Instant lastActivity(Task task) {
        return task.getLastActivityAt() != null ? task.getLastActivityAt() : task.getUpdatedAt();
    }
}
