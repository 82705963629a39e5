package io.buddy4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Entry of a task's append-only notification list.
 */
public record Notification(String message, NotificationLevel level, Instant timestamp) {

    public Notification {
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(level, "level must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }
}
