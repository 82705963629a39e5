package io.buddy4j.maintenance;

import io.buddy4j.core.PriorityScorer;
import io.buddy4j.core.Task;
import io.buddy4j.core.TaskFilter;
import io.buddy4j.core.TaskPatch;
import io.buddy4j.store.TaskStore;

import java.util.Objects;

/**
 * Refreshes dynamic priority scores that drifted because the calendar moved. Writes only changed scores.
 */
public class PrioritySweep implements MaintenancePass {

    private final TaskStore store;
    private final PriorityScorer scorer;

    public PrioritySweep(TaskStore store, PriorityScorer scorer) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
    }

    @Override
    public String name() {
        return "priority-sweep";
    }

    @Override
    public int run() {
        int written = 0;
        for (Task task : store.list(TaskFilter.builder().excludeTerminal().build())) {
            if (Double.compare(scorer.score(task), task.getDynamicPriorityScore()) == 0) {
                continue;
            }
            // an empty patch still makes the store recompute the score
            if (store.updateIf(task.getId(),
                    current -> Double.compare(scorer.score(current), current.getDynamicPriorityScore()) != 0,
                    TaskPatch.empty())) {
                written++;
            }
        }
        return written;
    }
}
