package io.buddy4j.core;

/**
 * Durable task storage could not be read or written.
 */
public class StorageUnavailableException extends BuddyException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
