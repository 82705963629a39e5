package io.buddy4j.core.dispatch;

import io.buddy4j.core.Task;

import java.util.List;
import java.util.Objects;

/**
 * What a handler receives.
 *
 * @param item    the dequeued work item
 * @param task    snapshot of the referenced task taken right before invocation, or {@code null}
 * @param history most recent interactions first, as conversational context
 */
public record HandlerRequest(WorkItem item, Task task, List<Interaction> history) {

    public HandlerRequest {
        Objects.requireNonNull(item, "item must not be null");
        history = history == null ? List.of() : List.copyOf(history);
        if (task != null && !task.getId().equals(item.taskId())) {
            throw new IllegalArgumentException(
                    "task snapshot " + task.getId() + " does not match work item task " + item.taskId());
        }
    }

    public String query() {
        return item.query();
    }
}
