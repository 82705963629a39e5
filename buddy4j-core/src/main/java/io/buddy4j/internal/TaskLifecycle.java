package io.buddy4j.internal;

import io.buddy4j.core.Notification;
import io.buddy4j.core.NotificationLevel;
import io.buddy4j.core.Task;
import io.buddy4j.core.TaskFilter;
import io.buddy4j.core.TaskPatch;
import io.buddy4j.core.TaskStatus;
import io.buddy4j.core.graph.DependencyGraphValidator;
import io.buddy4j.core.graph.Readiness;
import io.buddy4j.core.recurrence.RecurrenceMaterializer;
import io.buddy4j.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Status changes the supervisor makes on a task's behalf, and what follows a completion.
 */
class TaskLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TaskLifecycle.class);

    private final TaskStore store;
    private final DependencyGraphValidator validator;
    private final RecurrenceMaterializer materializer;
    private final Clock clock;

    TaskLifecycle(TaskStore store, DependencyGraphValidator validator, RecurrenceMaterializer materializer, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.materializer = Objects.requireNonNull(materializer, "materializer must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    boolean complete(String taskId) {
        boolean completed = store.updateIf(
                taskId,
                current -> current.getStatus() != TaskStatus.COMPLETED,
                TaskPatch.builder().status(TaskStatus.COMPLETED).progress(100).build()
        );
        if (completed) {
            log.info("Task completed taskId={}", taskId);
            afterCompletion(taskId);
        }
        return completed;
    }

    /**
     * Completes a task the dispatcher was working on. Skipped when the task was cancelled or completed
     * in the meantime.
     */
    boolean completeDispatched(String taskId) {
        boolean completed = store.updateIf(
                taskId,
                current -> current.getStatus() != TaskStatus.COMPLETED
                        && current.getStatus().canTransitionTo(TaskStatus.COMPLETED),
                TaskPatch.builder().status(TaskStatus.COMPLETED).progress(100).build()
        );
        if (completed) {
            log.info("Task completed by handler taskId={}", taskId);
            afterCompletion(taskId);
        } else {
            log.warn("Task changed while its handler ran, not completing taskId={}", taskId);
        }
        return completed;
    }

    boolean markInProgress(String taskId) {
        return store.update(taskId, TaskPatch.status(TaskStatus.IN_PROGRESS));
    }

    void block(String taskId, String message) {
        moveFromInProgress(taskId, TaskStatus.BLOCKED, notification(message, NotificationLevel.WARNING));
    }

    /**
     * Puts a task back to the status it had before dispatch, optionally noting why.
     */
    void restore(String taskId, TaskStatus prior, String errorMessage) {
        Notification note = errorMessage == null ? null : notification(errorMessage, NotificationLevel.ERROR);
        moveFromInProgress(taskId, prior, note);
    }

    /**
     * Follow-ups of a completion: release dependents, roll up the parent, materialize the next
     * occurrence.
     */
    void afterCompletion(String taskId) {
        Optional<Task> loaded = store.get(taskId);
        if (loaded.isEmpty()) {
            return;
        }
        Task task = loaded.get();

        for (Task dependent : store.list(TaskFilter.builder().dependsOn(taskId).status(TaskStatus.BLOCKED).build())) {
            releaseIfReady(dependent);
        }
        if (task.getParentId() != null) {
            rollUp(task.getParentId());
        }
        materializer.materialize(task);
    }

    /**
     * Moves a blocked task back to pending once all of its dependencies are completed.
     */
    boolean releaseIfReady(Task task) {
        if (task.getStatus() != TaskStatus.BLOCKED || !validator.isReady(task).ready()) {
            return false;
        }
        boolean released = store.updateIf(
                task.getId(),
                current -> current.getStatus() == TaskStatus.BLOCKED && validator.isReady(current).ready(),
                TaskPatch.builder()
                        .status(TaskStatus.PENDING)
                        .notify(notification("All dependencies completed; task is ready", NotificationLevel.INFO))
                        .build()
        );
        if (released) {
            log.info("Task unblocked taskId={}", task.getId());
        }
        return released;
    }

    /**
     * Sets a task to blocked if its dependencies are not all completed.
     *
     * @return the readiness that was checked
     */
    Readiness blockIfNotReady(Task task) {
        Readiness readiness = validator.isReady(task);
        if (!readiness.ready()) {
            String message = "Waiting on dependencies: " + String.join(", ", readiness.blocking());
            store.updateIf(task.getId(), current -> current.getStatus().canTransitionTo(TaskStatus.BLOCKED),
                    TaskPatch.builder().status(TaskStatus.BLOCKED).notify(notification(message, NotificationLevel.WARNING)).build());
        }
        return readiness;
    }

    private void rollUp(String parentId) {
        Optional<Task> loaded = store.get(parentId);
        if (loaded.isEmpty() || loaded.get().getStatus().isTerminal() || loaded.get().getSubtasks().isEmpty()) {
            return;
        }
        Task parent = loaded.get();
        long done = parent.getSubtasks().stream()
                .map(store::get)
                .filter(t -> t.isPresent() && t.get().getStatus() == TaskStatus.COMPLETED)
                .count();
        int progress = (int) (done * 100 / parent.getSubtasks().size());
        boolean changed = store.updateIf(
                parentId,
                current -> !current.getStatus().isTerminal() && current.getProgress() != progress,
                TaskPatch.builder().progress(progress).build()
        );
        if (changed) {
            log.debug("Rolled up parent progress parentId={} progress={}", parentId, progress);
            if (progress == 100) {
                afterCompletion(parentId);
            }
        }
    }

    private void moveFromInProgress(String taskId, TaskStatus target, Notification note) {
        TaskPatch.Builder patch = TaskPatch.builder().status(target);
        if (note != null) {
            patch.notify(note);
        }
        boolean moved = store.updateIf(taskId, current -> current.getStatus() == TaskStatus.IN_PROGRESS
                && TaskStatus.IN_PROGRESS.canTransitionTo(target), patch.build());
        if (!moved && note != null) {
            store.updateIf(taskId, current -> !current.getStatus().isTerminal(),
                    TaskPatch.builder().notify(note).build());
        }
    }

    private Notification notification(String message, NotificationLevel level) {
        return new Notification(message, level, clock.instant());
    }
}
