package io.buddy4j;

import io.buddy4j.core.Priority;
import io.buddy4j.core.RecurrenceType;
import io.buddy4j.core.Task;

import java.time.Instant;

/**
 * Fluent builder for configuring a task before persisting it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory draft</li>
 *   <li>save(): build() + create in the task store</li>
 * </ul>
 */
public interface TaskBuilder {

    TaskBuilder description(String description);

    TaskBuilder priority(Priority priority);

    TaskBuilder dueDate(Instant dueDate);

    /**
     * Create the task as a subtask of {@code parentId}. The parent must exist.
     */
    TaskBuilder parent(String parentId);

    /**
     * Add dependencies. Every id must exist and the new edges must not close a cycle.
     */
    TaskBuilder dependsOn(String... taskIds);

    /**
     * Pin the task to a handler instead of letting the classifier pick one.
     */
    TaskBuilder handler(String handlerName);

    /**
     * Repeat every {@code interval} units once completed.
     */
    TaskBuilder repeat(RecurrenceType type, int interval);

    TaskBuilder estimatedHours(double hours);

    TaskBuilder tags(String... tags);

    TaskBuilder milestone(String title);

    Task build();

    Task save();
}
