package io.buddy4j.internal;

import io.buddy4j.TaskBuilder;
import io.buddy4j.core.Milestone;
import io.buddy4j.core.Priority;
import io.buddy4j.core.Recurrence;
import io.buddy4j.core.RecurrenceType;
import io.buddy4j.core.Task;
import io.buddy4j.core.TaskValidationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Default {@link TaskBuilder} implementation.
 */
public class SimpleTaskBuilder implements TaskBuilder {

    private final String title;
    private final Function<Task, Task> persister;

    private String description = "";
    private Priority priority = Priority.MEDIUM;
    private Instant dueDate;
    private String parentId;
    private final Set<String> dependencies = new LinkedHashSet<>();
    private String handler;
    private Recurrence recurrence = Recurrence.none();
    private Double estimatedHours;
    private final Set<String> tags = new LinkedHashSet<>();
    private final List<Milestone> milestones = new ArrayList<>();

    public SimpleTaskBuilder(String title, Function<Task, Task> persister) {
        Objects.requireNonNull(title, "title must not be null");
        if (title.isBlank()) {
            throw new TaskValidationException("title must not be blank");
        }
        this.title = title;
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
    }

    @Override
    public TaskBuilder description(String description) {
        this.description = Objects.requireNonNull(description, "description must not be null");
        return this;
    }

    @Override
    public TaskBuilder priority(Priority priority) {
        this.priority = Objects.requireNonNull(priority, "priority must not be null");
        return this;
    }

    @Override
    public TaskBuilder dueDate(Instant dueDate) {
        this.dueDate = Objects.requireNonNull(dueDate, "dueDate must not be null");
        return this;
    }

    @Override
    public TaskBuilder parent(String parentId) {
        Objects.requireNonNull(parentId, "parentId must not be null");
        if (parentId.isBlank()) throw new IllegalArgumentException("parentId must not be blank");
        this.parentId = parentId;
        return this;
    }

    @Override
    public TaskBuilder dependsOn(String... taskIds) {
        for (String id : taskIds) {
            Objects.requireNonNull(id, "dependency id must not be null");
            if (id.isBlank()) throw new IllegalArgumentException("dependency id must not be blank");
            dependencies.add(id);
        }
        return this;
    }

    @Override
    public TaskBuilder handler(String handlerName) {
        Objects.requireNonNull(handlerName, "handlerName must not be null");
        if (handlerName.isBlank()) throw new IllegalArgumentException("handlerName must not be blank");
        this.handler = handlerName;
        return this;
    }

    @Override
    public TaskBuilder repeat(RecurrenceType type, int interval) {
        this.recurrence = new Recurrence(Objects.requireNonNull(type, "type must not be null"), interval);
        return this;
    }

    @Override
    public TaskBuilder estimatedHours(double hours) {
        if (hours < 0) {
            throw new TaskValidationException("estimatedHours must not be negative: " + hours);
        }
        this.estimatedHours = hours;
        return this;
    }

    @Override
    public TaskBuilder tags(String... tags) {
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                this.tags.add(tag.trim());
            }
        }
        return this;
    }

    @Override
    public TaskBuilder milestone(String title) {
        Objects.requireNonNull(title, "milestone title must not be null");
        this.milestones.add(Milestone.open(title));
        return this;
    }

    @Override
    public Task build() {
        Task draft = new Task(title);
        draft.setDescription(description);
        draft.setPriority(priority);
        draft.setDueDate(dueDate);
        draft.setParentId(parentId);
        draft.setDependencies(dependencies);
        draft.setAssignedHandler(handler);
        draft.setRecurrence(recurrence);
        draft.setEstimatedHours(estimatedHours);
        draft.setTags(tags);
        draft.setMilestones(milestones);
        return draft;
    }

    @Override
    public Task save() {
        return persister.apply(build());
    }
}
