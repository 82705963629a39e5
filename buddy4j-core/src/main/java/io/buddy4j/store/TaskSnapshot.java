package io.buddy4j.store;

import io.buddy4j.core.Task;

import java.util.List;

/**
 * Serialized form of a whole store, used by the JSON file backend and by backups.
 */
public record TaskSnapshot(int version, List<Task> tasks) {

    public static final int CURRENT_VERSION = 1;

    public TaskSnapshot {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public static TaskSnapshot of(List<Task> tasks) {
        return new TaskSnapshot(CURRENT_VERSION, tasks);
    }
}
