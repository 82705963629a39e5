package io.buddy4j.core.dispatch;

import java.time.Instant;
import java.util.Objects;

/**
 * One finished exchange with a handler.
 */
public record Interaction(
        String query,
        String handler,
        String response,
        String taskId,
        boolean success,
        Instant timestamp
) {

    public Interaction {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        Objects.requireNonNull(response, "response must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }
}
