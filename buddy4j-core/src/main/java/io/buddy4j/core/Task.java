package io.buddy4j.core;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A unit of work tracked by the task store.
 *
 * <p>Instances handed out by a {@link io.buddy4j.store.TaskStore} are detached copies: mutating them
 * has no effect until the change is written back through a {@link TaskPatch}. The store owns
 * {@code id}, {@code subtasks}, {@code dynamicPriorityScore}, the timestamps and {@code revision}.
 */
public class Task {

    private String id;
    private String title;
    private String description = "";
    private TaskStatus status = TaskStatus.PENDING;
    private Priority priority = Priority.MEDIUM;
    private double dynamicPriorityScore;
    private Instant dueDate;
    private Set<String> dependencies = new LinkedHashSet<>();
    private Set<String> subtasks = new LinkedHashSet<>();
    private String parentId;
    private String assignedHandler;
    private int progress;
    private Recurrence recurrence = Recurrence.none();
    private Instant nextOccurrence;
    private String recurrenceOf;
    private Double estimatedHours;
    private Set<String> tags = new LinkedHashSet<>();
    private List<Milestone> milestones = new ArrayList<>();
    private List<Notification> notifications = new ArrayList<>();
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastActivityAt;
    private DeadlineAlert lastDeadlineAlert;
    private Instant staleFlaggedAt;
    private long revision;

    public Task() {
    }

    public Task(String title) {
        this.title = title;
    }

    public Task copy() {
        Task c = new Task();
        c.id = id;
        c.title = title;
        c.description = description;
        c.status = status;
        c.priority = priority;
        c.dynamicPriorityScore = dynamicPriorityScore;
        c.dueDate = dueDate;
        c.dependencies = new LinkedHashSet<>(dependencies);
        c.subtasks = new LinkedHashSet<>(subtasks);
        c.parentId = parentId;
        c.assignedHandler = assignedHandler;
        c.progress = progress;
        c.recurrence = recurrence;
        c.nextOccurrence = nextOccurrence;
        c.recurrenceOf = recurrenceOf;
        c.estimatedHours = estimatedHours;
        c.tags = new LinkedHashSet<>(tags);
        c.milestones = new ArrayList<>(milestones);
        c.notifications = new ArrayList<>(notifications);
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        c.lastActivityAt = lastActivityAt;
        c.lastDeadlineAlert = lastDeadlineAlert;
        c.staleFlaggedAt = staleFlaggedAt;
        c.revision = revision;
        return c;
    }

    /**
     * Next occurrence derived from the recurrence settings: due date (or last update when the task has
     * no due date) plus one period. {@code null} for non-recurring tasks.
     */
    public Instant computeNextOccurrence() {
        if (recurrence == null || !recurrence.isRecurring()) {
            return null;
        }
        Instant base = dueDate != null ? dueDate : updatedAt;
        return recurrence.nextAfter(base);
    }

    @JsonIgnore
    public boolean isRecurringOrigin() {
        return recurrence != null && recurrence.isRecurring() && recurrenceOf == null;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public void setStatus(TaskStatus status) {
        this.status = status;
    }

    public Priority getPriority() {
        return priority;
    }

    public void setPriority(Priority priority) {
        this.priority = priority;
    }

    public double getDynamicPriorityScore() {
        return dynamicPriorityScore;
    }

    public void setDynamicPriorityScore(double dynamicPriorityScore) {
        this.dynamicPriorityScore = dynamicPriorityScore;
    }

    public Instant getDueDate() {
        return dueDate;
    }

    public void setDueDate(Instant dueDate) {
        this.dueDate = dueDate;
    }

    public Set<String> getDependencies() {
        return dependencies;
    }

    public void setDependencies(Set<String> dependencies) {
        this.dependencies = dependencies == null ? new LinkedHashSet<>() : new LinkedHashSet<>(dependencies);
    }

    public Set<String> getSubtasks() {
        return subtasks;
    }

    public void setSubtasks(Set<String> subtasks) {
        this.subtasks = subtasks == null ? new LinkedHashSet<>() : new LinkedHashSet<>(subtasks);
    }

    public String getParentId() {
        return parentId;
    }

    public void setParentId(String parentId) {
        this.parentId = parentId;
    }

    public String getAssignedHandler() {
        return assignedHandler;
    }

    public void setAssignedHandler(String assignedHandler) {
        this.assignedHandler = assignedHandler;
    }

    public int getProgress() {
        return progress;
    }

    public void setProgress(int progress) {
        this.progress = progress;
    }

    public Recurrence getRecurrence() {
        return recurrence;
    }

    public void setRecurrence(Recurrence recurrence) {
        this.recurrence = recurrence == null ? Recurrence.none() : recurrence;
    }

    public Instant getNextOccurrence() {
        return nextOccurrence;
    }

    public void setNextOccurrence(Instant nextOccurrence) {
        this.nextOccurrence = nextOccurrence;
    }

    public String getRecurrenceOf() {
        return recurrenceOf;
    }

    public void setRecurrenceOf(String recurrenceOf) {
        this.recurrenceOf = recurrenceOf;
    }

    public Double getEstimatedHours() {
        return estimatedHours;
    }

    public void setEstimatedHours(Double estimatedHours) {
        this.estimatedHours = estimatedHours;
    }

    public Set<String> getTags() {
        return tags;
    }

    public void setTags(Set<String> tags) {
        this.tags = tags == null ? new LinkedHashSet<>() : new LinkedHashSet<>(tags);
    }

    public List<Milestone> getMilestones() {
        return milestones;
    }

    public void setMilestones(List<Milestone> milestones) {
        this.milestones = milestones == null ? new ArrayList<>() : new ArrayList<>(milestones);
    }

    public List<Notification> getNotifications() {
        return notifications;
    }

    public void setNotifications(List<Notification> notifications) {
        this.notifications = notifications == null ? new ArrayList<>() : new ArrayList<>(notifications);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    public void setLastActivityAt(Instant lastActivityAt) {
        this.lastActivityAt = lastActivityAt;
    }

    public DeadlineAlert getLastDeadlineAlert() {
        return lastDeadlineAlert;
    }

    public void setLastDeadlineAlert(DeadlineAlert lastDeadlineAlert) {
        this.lastDeadlineAlert = lastDeadlineAlert;
    }

    public Instant getStaleFlaggedAt() {
        return staleFlaggedAt;
    }

    public void setStaleFlaggedAt(Instant staleFlaggedAt) {
        this.staleFlaggedAt = staleFlaggedAt;
    }

    public long getRevision() {
        return revision;
    }

    public void setRevision(long revision) {
        this.revision = revision;
    }

    @Override
    public String toString() {
        return "Task{id=" + id + ", title=" + title + ", status=" + status + ", revision=" + revision + "}";
    }
}
