package io.buddy4j.core;

/**
 * Base class of the unchecked exceptions raised by buddy4j.
 */
public class BuddyException extends RuntimeException {

    public BuddyException(String message) {
        super(message);
    }

    public BuddyException(String message, Throwable cause) {
        super(message, cause);
    }
}
