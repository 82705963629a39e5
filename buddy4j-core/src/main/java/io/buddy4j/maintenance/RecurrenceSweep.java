package io.buddy4j.maintenance;

import io.buddy4j.core.Task;
import io.buddy4j.core.TaskFilter;
import io.buddy4j.core.TaskStatus;
import io.buddy4j.core.recurrence.RecurrenceMaterializer;
import io.buddy4j.store.TaskStore;

import java.util.Objects;

public class RecurrenceSweep implements MaintenancePass {

    private final TaskStore store;
    private final RecurrenceMaterializer materializer;

    public RecurrenceSweep(TaskStore store, RecurrenceMaterializer materializer) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.materializer = Objects.requireNonNull(materializer, "materializer must not be null");
    }

    @Override
    public String name() {
        return "recurrence-sweep";
    }

    @Override
    public int run() {
        int created = 0;
        for (Task task : store.list(TaskFilter.builder().status(TaskStatus.COMPLETED).build())) {
            if (materializer.isDue(task) && materializer.materialize(task).isPresent()) {
                created++;
            }
        }
        return created;
    }
}
