package io.buddy4j.store;

import io.buddy4j.core.Task;
import io.buddy4j.core.TaskFilter;
import io.buddy4j.core.TaskNotFoundException;
import io.buddy4j.core.TaskPatch;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Durable keyed collection of tasks.
 *
 * <p>Every write is atomic per task and validated before anything is persisted. Reads return detached
 * copies. Unknown ids yield {@link Optional#empty()} or {@code false} rather than an exception, except
 * for {@link #getRequired(String)}.
 */
public interface TaskStore {

    /**
     * Verifies the backing storage and loads whatever it needs. Safe to call more than once.
     *
     * @throws io.buddy4j.core.StorageUnavailableException if storage is unreadable or unreachable
     */
    void open();

    void close();

    /**
     * Persists a new task built from {@code draft}. The store assigns the id (unless the draft carries
     * one), timestamps, score and revision, starts the task as pending, and links it into its parent's
     * subtasks.
     */
    Task create(Task draft);

    Optional<Task> get(String id);

    default Task getRequired(String id) {
        return get(id).orElseThrow(() -> new TaskNotFoundException(id));
    }

    default boolean update(String id, TaskPatch patch) {
        return updateIf(id, task -> true, patch);
    }

    /**
     * Applies {@code patch} only if the current state satisfies {@code condition}; the check and the
     * write form one atomic step.
     *
     * @return false when the task does not exist or the condition does not hold
     */
    boolean updateIf(String id, Predicate<Task> condition, TaskPatch patch);

    /**
     * Deletes the task and, recursively, its subtasks, and drops their ids from every other task's
     * dependencies and subtasks.
     */
    boolean delete(String id);

    List<Task> list(TaskFilter filter);

    default List<Task> list() {
        return list(TaskFilter.all());
    }

    /**
     * Writes every task to {@code path} as a JSON document {@code {"version":1,"tasks":[...]}}.
     */
    void backup(Path path);

    /**
     * Replaces the whole store with the content of a backup document after validating it.
     */
    void restore(Path path);
}
