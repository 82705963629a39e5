package io.buddy4j.core.dispatch;

import java.util.Objects;

/**
 * One request waiting in the work queue.
 *
 * @param taskId          task the request works on, or {@code null} for free-form queries
 * @param query           request text handed to the classifier and the handler
 * @param assignedHandler handler to use instead of asking the classifier, or {@code null}
 */
public record WorkItem(String taskId, String query, String assignedHandler) {

    public WorkItem {
        Objects.requireNonNull(query, "query must not be null");
        taskId = (taskId == null || taskId.isBlank()) ? null : taskId;
        assignedHandler = (assignedHandler == null || assignedHandler.isBlank()) ? null : assignedHandler;
    }

    public static WorkItem of(String query) {
        return new WorkItem(null, query, null);
    }

    public static WorkItem forTask(String taskId, String query) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        return new WorkItem(taskId, query, null);
    }

    public WorkItem withHandler(String handler) {
        return new WorkItem(taskId, query, handler);
    }
}
