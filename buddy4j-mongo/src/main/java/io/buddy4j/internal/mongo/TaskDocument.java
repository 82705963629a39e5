package io.buddy4j.internal.mongo;

import io.buddy4j.core.Priority;
import io.buddy4j.core.TaskStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Mongo document model for persisted tasks. Nested value types are stored as plain maps.
 */
@Document(collection = "buddy_tasks")
public class TaskDocument {

    @Id
    private String id;
    private String title;
    private String description;
    private TaskStatus status;
    private Priority priority;

    private double dynamicPriorityScore;
    @Field(write = Field.Write.ALWAYS)
    private Instant dueDate;

    private List<String> dependencies;
    private List<String> subtasks;

    private String parentId;
    private String assignedHandler;
    private int progress;

    private Map<String, Object> recurrence;
    @Field(write = Field.Write.ALWAYS)
    private Instant nextOccurrence;
    private String recurrenceOf;

    private Double estimatedHours;
    private List<String> tags;
    private List<Map<String, Object>> milestones;
    private List<Map<String, Object>> notifications;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastActivityAt;

    private Map<String, Object> lastDeadlineAlert;
    private Instant staleFlaggedAt;
    private long revision;

    public TaskDocument() {
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

    public List<String> getDependencies() {
        return dependencies;
    }

    public void setDependencies(List<String> dependencies) {
        this.dependencies = dependencies;
    }

    public List<String> getSubtasks() {
        return subtasks;
    }

    public void setSubtasks(List<String> subtasks) {
        this.subtasks = subtasks;
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

    public Map<String, Object> getRecurrence() {
        return recurrence;
    }

    public void setRecurrence(Map<String, Object> recurrence) {
        this.recurrence = recurrence;
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

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags;
    }

    public List<Map<String, Object>> getMilestones() {
        return milestones;
    }

    public void setMilestones(List<Map<String, Object>> milestones) {
        this.milestones = milestones;
    }

    public List<Map<String, Object>> getNotifications() {
        return notifications;
    }

    public void setNotifications(List<Map<String, Object>> notifications) {
        this.notifications = notifications;
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

    public Map<String, Object> getLastDeadlineAlert() {
        return lastDeadlineAlert;
    }

    public void setLastDeadlineAlert(Map<String, Object> lastDeadlineAlert) {
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
}
