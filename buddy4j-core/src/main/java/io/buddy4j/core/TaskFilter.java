package io.buddy4j.core;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * TaskFilter describes which tasks a {@code list} call returns.
 *
 * <p>This is an API-layer object (NOT a database query). Each store backend either evaluates
 * {@link #matches(Task)} in memory or translates the selectors into its own query language.
 * Selectors are combined with AND; an empty filter matches every task.
 */
public final class TaskFilter {

    private static final TaskFilter ALL = new Builder().build();

    private final Set<TaskStatus> statuses;
    private final Priority priority;
    private final String assignedHandler;
    private final String parentId;
    private final String dependsOn;
    private final String tag;
    private final Instant dueBefore;
    private final boolean excludeTerminal;

    private TaskFilter(Builder b) {
        this.statuses = b.statuses.isEmpty() ? null : Collections.unmodifiableSet(EnumSet.copyOf(b.statuses));
        this.priority = b.priority;
        this.assignedHandler = blankToNull(b.assignedHandler);
        this.parentId = blankToNull(b.parentId);
        this.dependsOn = blankToNull(b.dependsOn);
        this.tag = blankToNull(b.tag);
        this.dueBefore = b.dueBefore;
        this.excludeTerminal = b.excludeTerminal;
    }

    public static TaskFilter all() {
        return ALL;
    }

    /**
     * Accepted statuses, or {@code null} for any.
     */
    public Set<TaskStatus> statuses() {
        return statuses;
    }

    public Priority priority() {
        return priority;
    }

    public String assignedHandler() {
        return assignedHandler;
    }

    public String parentId() {
        return parentId;
    }

    /**
     * Matches tasks whose dependency set contains this id.
     */
    public String dependsOn() {
        return dependsOn;
    }

    public String tag() {
        return tag;
    }

    /**
     * Matches tasks with a due date strictly before this instant.
     */
    public Instant dueBefore() {
        return dueBefore;
    }

    public boolean excludeTerminal() {
        return excludeTerminal;
    }

    public boolean isEmpty() {
        return statuses == null
                && priority == null
                && assignedHandler == null
                && parentId == null
                && dependsOn == null
                && tag == null
                && dueBefore == null
                && !excludeTerminal;
    }

    public boolean matches(Task task) {
        Objects.requireNonNull(task, "task must not be null");
        if (statuses != null && !statuses.contains(task.getStatus())) {
            return false;
        }
        if (excludeTerminal && task.getStatus().isTerminal()) {
            return false;
        }
        if (priority != null && priority != task.getPriority()) {
            return false;
        }
        if (assignedHandler != null && !assignedHandler.equals(task.getAssignedHandler())) {
            return false;
        }
        if (parentId != null && !parentId.equals(task.getParentId())) {
            return false;
        }
        if (dependsOn != null && !task.getDependencies().contains(dependsOn)) {
            return false;
        }
        if (tag != null && !task.getTags().contains(tag)) {
            return false;
        }
        return dueBefore == null || (task.getDueDate() != null && task.getDueDate().isBefore(dueBefore));
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value;
    }

    public static final class Builder {
        private final Set<TaskStatus> statuses = EnumSet.noneOf(TaskStatus.class);
        private Priority priority;
        private String assignedHandler;
        private String parentId;
        private String dependsOn;
        private String tag;
        private Instant dueBefore;
        private boolean excludeTerminal;

        public Builder status(TaskStatus... statuses) {
            for (TaskStatus status : statuses) {
                this.statuses.add(Objects.requireNonNull(status, "status must not be null"));
            }
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder assignedHandler(String assignedHandler) {
            this.assignedHandler = assignedHandler;
            return this;
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder dependsOn(String taskId) {
            this.dependsOn = taskId;
            return this;
        }

        public Builder tag(String tag) {
            this.tag = tag;
            return this;
        }

        public Builder dueBefore(Instant dueBefore) {
            this.dueBefore = dueBefore;
            return this;
        }

        public Builder excludeTerminal() {
            this.excludeTerminal = true;
            return this;
        }

        public TaskFilter build() {
            return new TaskFilter(this);
        }
    }
}
