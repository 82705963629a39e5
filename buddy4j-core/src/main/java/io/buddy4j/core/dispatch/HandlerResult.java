package io.buddy4j.core.dispatch;

import java.util.Objects;

/**
 * What a handler returns. A failed result is treated like a thrown exception, without the stack trace.
 */
public record HandlerResult(String text, boolean success) {

    public HandlerResult {
        Objects.requireNonNull(text, "text must not be null");
    }

    public static HandlerResult ok(String text) {
        return new HandlerResult(text, true);
    }

    public static HandlerResult failed(String text) {
        return new HandlerResult(text, false);
    }
}
