package io.buddy4j.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A partial update of a task. Unset fields are left alone.
 *
 * <p>{@link #applyTo(Task)} validates while it mutates, so stores apply a patch to a private copy and
 * only write the copy back once every check has passed.
 */
public final class TaskPatch {

    private static final TaskPatch EMPTY = new Builder().build();

    private final String title;
    private final String description;
    private final TaskStatus status;
    private final Priority priority;
    private final boolean dueDateSet;
    private final Instant dueDate;
    private final Integer progress;
    private final boolean assignedHandlerSet;
    private final String assignedHandler;
    private final Set<String> dependencies;
    private final Set<String> addedDependencies;
    private final Set<String> removedDependencies;
    private final Recurrence recurrence;
    private final boolean estimatedHoursSet;
    private final Double estimatedHours;
    private final Set<String> tags;
    private final List<Milestone> milestones;
    private final boolean nextOccurrenceSet;
    private final Instant nextOccurrence;
    private final List<Notification> notifications;
    private final DeadlineAlert deadlineAlert;
    private final Instant staleFlaggedAt;

    private TaskPatch(Builder b) {
        this.title = b.title;
        this.description = b.description;
        this.status = b.status;
        this.priority = b.priority;
        this.dueDateSet = b.dueDateSet;
        this.dueDate = b.dueDate;
        this.progress = b.progress;
        this.assignedHandlerSet = b.assignedHandlerSet;
        this.assignedHandler = b.assignedHandler;
        this.dependencies = b.dependencies == null ? null : Set.copyOf(b.dependencies);
        this.addedDependencies = Set.copyOf(b.addedDependencies);
        this.removedDependencies = Set.copyOf(b.removedDependencies);
        this.recurrence = b.recurrence;
        this.estimatedHoursSet = b.estimatedHoursSet;
        this.estimatedHours = b.estimatedHours;
        this.tags = b.tags == null ? null : new LinkedHashSet<>(b.tags);
        this.milestones = b.milestones == null ? null : List.copyOf(b.milestones);
        this.nextOccurrenceSet = b.nextOccurrenceSet;
        this.nextOccurrence = b.nextOccurrence;
        this.notifications = List.copyOf(b.notifications);
        this.deadlineAlert = b.deadlineAlert;
        this.staleFlaggedAt = b.staleFlaggedAt;
    }

    public static TaskPatch empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TaskPatch status(TaskStatus status) {
        return builder().status(status).build();
    }

    /**
     * True when the patch changes what the task is about or how far along it is, as opposed to
     * bookkeeping such as notifications and sweep markers. Work changes refresh {@code lastActivityAt}.
     */
    public boolean touchesWork() {
        return title != null
                || description != null
                || status != null
                || priority != null
                || dueDateSet
                || progress != null
                || assignedHandlerSet
                || dependencies != null
                || !addedDependencies.isEmpty()
                || !removedDependencies.isEmpty()
                || recurrence != null
                || estimatedHoursSet
                || tags != null
                || milestones != null;
    }

    public boolean touchesDependencies() {
        return dependencies != null || !addedDependencies.isEmpty() || !removedDependencies.isEmpty();
    }

    public boolean isEmpty() {
        return !touchesWork()
                && !nextOccurrenceSet
                && notifications.isEmpty()
                && deadlineAlert == null
                && staleFlaggedAt == null;
    }

    /**
     * Applies this patch to {@code target}.
     *
     * @throws TaskValidationException when the result would break a task invariant; {@code target} may
     *                                 then be half-modified and must be discarded
     */
    public void applyTo(Task target) {
        Objects.requireNonNull(target, "target must not be null");

        if (title != null) {
            if (title.isBlank()) {
                throw new TaskValidationException("title must not be blank");
            }
            target.setTitle(title);
        }
        if (description != null) {
            target.setDescription(description);
        }
        if (priority != null) {
            target.setPriority(priority);
        }
        if (dueDateSet) {
            target.setDueDate(dueDate);
        }
        if (assignedHandlerSet) {
            target.setAssignedHandler(assignedHandler);
        }
        if (dependencies != null) {
            target.setDependencies(dependencies);
        }
        target.getDependencies().addAll(addedDependencies);
        target.getDependencies().removeAll(removedDependencies);
        if (recurrence != null) {
            target.setRecurrence(recurrence);
        }
        if (estimatedHoursSet) {
            if (estimatedHours != null && estimatedHours < 0) {
                throw new TaskValidationException("estimatedHours must not be negative: " + estimatedHours);
            }
            target.setEstimatedHours(estimatedHours);
        }
        if (tags != null) {
            target.setTags(tags);
        }
        if (milestones != null) {
            target.setMilestones(milestones);
        }

        if (status != null) {
            TaskStatus current = target.getStatus();
            if (!current.canTransitionTo(status)) {
                throw new TaskValidationException(
                        "Illegal status transition " + current.label() + " -> " + status.label());
            }
            target.setStatus(status);
        }
        if (progress != null) {
            if (progress < 0 || progress > 100) {
                throw new TaskValidationException("progress must be within 0..100: " + progress);
            }
            target.setProgress(progress);
        }
        if (target.getProgress() == 100 && target.getStatus() != TaskStatus.COMPLETED) {
            if (target.getStatus() == TaskStatus.CANCELLED) {
                throw new TaskValidationException("A cancelled task cannot reach 100% progress");
            }
            target.setStatus(TaskStatus.COMPLETED);
        }

        if (nextOccurrenceSet) {
            target.setNextOccurrence(nextOccurrence);
        } else if (recurrence != null || dueDateSet) {
            target.setNextOccurrence(target.computeNextOccurrence());
        }
        target.getNotifications().addAll(notifications);
        if (deadlineAlert != null) {
            target.setLastDeadlineAlert(deadlineAlert);
        }
        if (staleFlaggedAt != null) {
            target.setStaleFlaggedAt(staleFlaggedAt);
        }
    }

    public static final class Builder {
        private String title;
        private String description;
        private TaskStatus status;
        private Priority priority;
        private boolean dueDateSet;
        private Instant dueDate;
        private Integer progress;
        private boolean assignedHandlerSet;
        private String assignedHandler;
        private Set<String> dependencies;
        private final Set<String> addedDependencies = new LinkedHashSet<>();
        private final Set<String> removedDependencies = new LinkedHashSet<>();
        private Recurrence recurrence;
        private boolean estimatedHoursSet;
        private Double estimatedHours;
        private Set<String> tags;
        private List<Milestone> milestones;
        private boolean nextOccurrenceSet;
        private Instant nextOccurrence;
        private final List<Notification> notifications = new ArrayList<>();
        private DeadlineAlert deadlineAlert;
        private Instant staleFlaggedAt;

        public Builder title(String title) {
            this.title = Objects.requireNonNull(title, "title must not be null");
            return this;
        }

        public Builder description(String description) {
            this.description = Objects.requireNonNull(description, "description must not be null");
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = Objects.requireNonNull(status, "status must not be null");
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = Objects.requireNonNull(priority, "priority must not be null");
            return this;
        }

        public Builder dueDate(Instant dueDate) {
            this.dueDateSet = true;
            this.dueDate = Objects.requireNonNull(dueDate, "dueDate must not be null");
            return this;
        }

        public Builder clearDueDate() {
            this.dueDateSet = true;
            this.dueDate = null;
            return this;
        }

        public Builder progress(int progress) {
            this.progress = progress;
            return this;
        }

        public Builder assignedHandler(String handler) {
            this.assignedHandlerSet = true;
            this.assignedHandler = (handler == null || handler.isBlank()) ? null : handler;
            return this;
        }

        public Builder clearAssignedHandler() {
            return assignedHandler(null);
        }

        /**
         * Replaces the whole dependency set.
         */
        public Builder dependencies(Set<String> dependencies) {
            this.dependencies = new LinkedHashSet<>(Objects.requireNonNull(dependencies, "dependencies must not be null"));
            return this;
        }

        public Builder addDependency(String taskId) {
            this.addedDependencies.add(Objects.requireNonNull(taskId, "taskId must not be null"));
            return this;
        }

        public Builder removeDependency(String taskId) {
            this.removedDependencies.add(Objects.requireNonNull(taskId, "taskId must not be null"));
            return this;
        }

        public Builder recurrence(Recurrence recurrence) {
            this.recurrence = Objects.requireNonNull(recurrence, "recurrence must not be null");
            return this;
        }

        public Builder estimatedHours(Double estimatedHours) {
            this.estimatedHoursSet = true;
            this.estimatedHours = estimatedHours;
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags = new LinkedHashSet<>(Objects.requireNonNull(tags, "tags must not be null"));
            return this;
        }

        public Builder milestones(List<Milestone> milestones) {
            this.milestones = new ArrayList<>(Objects.requireNonNull(milestones, "milestones must not be null"));
            return this;
        }

        public Builder nextOccurrence(Instant nextOccurrence) {
            this.nextOccurrenceSet = true;
            this.nextOccurrence = nextOccurrence;
            return this;
        }

        public Builder notify(Notification notification) {
            this.notifications.add(Objects.requireNonNull(notification, "notification must not be null"));
            return this;
        }

        public Builder deadlineAlert(DeadlineAlert deadlineAlert) {
            this.deadlineAlert = Objects.requireNonNull(deadlineAlert, "deadlineAlert must not be null");
            return this;
        }

        public Builder staleFlaggedAt(Instant staleFlaggedAt) {
            this.staleFlaggedAt = Objects.requireNonNull(staleFlaggedAt, "staleFlaggedAt must not be null");
            return this;
        }

        public TaskPatch build() {
            return new TaskPatch(this);
        }
    }
}
