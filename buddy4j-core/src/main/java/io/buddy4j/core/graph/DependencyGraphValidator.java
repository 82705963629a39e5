package io.buddy4j.core.graph;

import io.buddy4j.core.Task;
import io.buddy4j.core.TaskStatus;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Checks the {@code dependencies} graph for missing nodes and cycles, and answers readiness questions.
 *
 * <p>The validator reads tasks through a lookup function, so it works against any store. Validating a
 * {@link Task} instance instead of an id overlays that instance on the stored graph, which is how a
 * proposed dependency set is checked before it is persisted.
 */
public class DependencyGraphValidator {

    private final Function<String, Optional<Task>> lookup;

    public DependencyGraphValidator(Function<String, Optional<Task>> lookup) {
        this.lookup = Objects.requireNonNull(lookup, "lookup must not be null");
    }

    public ValidationResult validate(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Optional<Task> task = lookup.apply(taskId);
        if (task.isEmpty()) {
            return ValidationResult.of(List.of("Task " + taskId + " not found"), false);
        }
        return validate(task.get());
    }

    /**
     * Validates the graph reachable from {@code candidate}, using {@code candidate} in place of the
     * stored task with the same id.
     */
    public ValidationResult validate(Task candidate) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        Walk walk = new Walk(candidate);
        walk.visit(candidate.getId(), new ArrayList<>());
        return ValidationResult.of(walk.errors, walk.cycleDetected);
    }

    public Optional<Readiness> isReady(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        return lookup.apply(taskId).map(this::isReady);
    }

    public Readiness isReady(Task task) {
        Objects.requireNonNull(task, "task must not be null");
        List<String> blocking = new ArrayList<>();
        for (String dependencyId : task.getDependencies()) {
            Optional<Task> dependency = lookup.apply(dependencyId);
            if (dependency.isEmpty()) {
                blocking.add(dependencyId + " (missing)");
            } else if (dependency.get().getStatus() != TaskStatus.COMPLETED) {
                blocking.add(dependency.get().getTitle() + " (" + dependency.get().getStatus().label() + ")");
            }
        }
        return new Readiness(blocking.isEmpty(), blocking);
    }

    private final class Walk {
        private final Task overlay;
        private final Set<String> done = new HashSet<>();
        private final Set<String> onStack = new LinkedHashSet<>();
        private final List<String> errors = new ArrayList<>();
        private boolean cycleDetected;

        Walk(Task overlay) {
            this.overlay = overlay;
        }

        void visit(String id, List<String> path) {
            Task task = resolve(id);
            if (task == null) {
                String from = path.isEmpty() ? null : path.get(path.size() - 1);
                errors.add(from == null
                        ? "Task " + id + " not found"
                        : "Dependency " + id + " of task " + from + " not found");
                done.add(id);
                return;
            }
            onStack.add(id);
            path.add(id);
            for (String next : task.getDependencies()) {
                if (onStack.contains(next)) {
                    List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                    cycle.add(next);
                    errors.add("Dependency cycle detected: " + String.join(" -> ", cycle));
                    cycleDetected = true;
                } else if (!done.contains(next)) {
                    visit(next, path);
                }
            }
            path.remove(path.size() - 1);
            onStack.remove(id);
            done.add(id);
        }

        private Task resolve(String id) {
            if (id.equals(overlay.getId())) {
                return overlay;
            }
            return lookup.apply(id).orElse(null);
        }
    }
}
