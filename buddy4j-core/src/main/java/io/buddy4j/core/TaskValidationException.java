package io.buddy4j.core;

import java.util.List;

/**
 * A create or update was rejected. Nothing was written.
 */
public class TaskValidationException extends BuddyException {

    private final List<String> errors;

    public TaskValidationException(String message) {
        this(List.of(message));
    }

    public TaskValidationException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
