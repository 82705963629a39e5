package io.buddy4j.core;

/**
 * Raised when a task kept changing underneath a conditional write until the retry budget ran out.
 */
public class ConcurrentTaskUpdateException extends BuddyException {

    public ConcurrentTaskUpdateException(String taskId, int attempts) {
        super("Gave up writing task " + taskId + " after " + attempts + " conflicting attempts");
    }
}
