package io.buddy4j;

import io.buddy4j.core.Task;
import io.buddy4j.core.TaskFilter;
import io.buddy4j.core.TaskPatch;
import io.buddy4j.core.TaskStats;
import io.buddy4j.core.dispatch.HandlerState;
import io.buddy4j.core.dispatch.Interaction;
import io.buddy4j.core.dispatch.WorkItem;
import io.buddy4j.core.graph.Readiness;
import io.buddy4j.core.graph.ValidationResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main task and dispatch API.
 *
 * <p>Two groups of operations:
 * <ul>
 *   <li>Task lifecycle: create, update, complete and delete tasks, manage dependencies, query</li>
 *   <li>Dispatch: queue requests for handlers; one dispatcher thread hands them out, at most one
 *   active request per handler</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * buddy.start();
 *
 * Task report = buddy.create("Write quarterly report")
 *       .priority(Priority.HIGH)
 *       .dueDate(Instant.parse("2026-03-31T17:00:00Z"))
 *       .handler("task_management")
 *       .save();
 *
 * buddy.dispatchTask(report.getId());
 * buddy.submit("what is on my calendar tomorrow?");
 * buddy.stop();
 * }</pre>
 */
public interface Buddy {

    /**
     * Opens the task store and starts the dispatcher, the worker pool and the maintenance timers.
     * Idempotent.
     *
     * @throws io.buddy4j.core.StorageUnavailableException if the task store cannot be opened
     */
    void start();

    /**
     * Stops dispatching, cancels the maintenance timers and waits for running handler calls.
     * Idempotent.
     */
    void stop();

    boolean isRunning();

    TaskBuilder create(String title);

    Optional<Task> get(String taskId);

    List<Task> list(TaskFilter filter);

    boolean update(String taskId, TaskPatch patch);

    /**
     * Deletes the task with its subtasks and removes every reference to them.
     */
    boolean delete(String taskId);

    /**
     * @throws io.buddy4j.core.DependencyCycleException if the edge would close a cycle
     */
    boolean addDependency(String taskId, String dependsOnId);

    boolean removeDependency(String taskId, String dependsOnId);

    ValidationResult validateDependencies(String taskId);

    Optional<Readiness> readiness(String taskId);

    /**
     * Marks the task completed outside the dispatcher and runs the completion follow-ups: unblocking
     * dependents, rolling up the parent's progress and materializing a due recurrence.
     */
    boolean complete(String taskId);

    void submit(WorkItem item);

    void submit(String query);

    /**
     * Queues the task for its assigned handler, or for whatever the classifier picks from its title.
     *
     * @return false if the task does not exist
     */
    boolean dispatchTask(String taskId);

    /**
     * Splits a goal into subtasks under a new in-progress parent. Subtasks are created, not queued.
     *
     * @return the parent task
     */
    Task enqueueComplexGoal(String goal);

    /**
     * Open tasks, highest dynamic priority first.
     */
    List<Task> prioritized();

    TaskStats stats();

    List<Interaction> recentInteractions(int limit);

    Map<String, HandlerState> handlerStates();

    /**
     * Runs every maintenance pass once, now, on the calling thread.
     *
     * @return tasks written per pass name
     */
    Map<String, Integer> runMaintenance();

    void backup(Path path);

    void restore(Path path);
}
