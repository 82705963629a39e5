package io.buddy4j.maintenance;

import io.buddy4j.core.DeadlineAlert;
import io.buddy4j.core.DeadlineTier;
import io.buddy4j.core.Notification;
import io.buddy4j.core.Task;
import io.buddy4j.core.TaskFilter;
import io.buddy4j.core.TaskPatch;
import io.buddy4j.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Appends one notification per task, tier and day for tasks that are overdue, due today or due
 * tomorrow.
 */
public class DeadlineSweep implements MaintenancePass {

    private static final Logger log = LoggerFactory.getLogger(DeadlineSweep.class);

    private final TaskStore store;
    private final Clock clock;

    public DeadlineSweep(TaskStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String name() {
        return "deadline-sweep";
    }

    @Override
    public int run() {
        int written = 0;
        LocalDate today = LocalDate.now(clock);
        for (Task task : store.list(TaskFilter.builder().excludeTerminal().build())) {
            Optional<DeadlineTier> tier = DeadlineTier.classify(task.getDueDate(), clock);
            if (tier.isEmpty()) {
                continue;
            }
            DeadlineAlert alert = new DeadlineAlert(tier.get(), today);
            if (alert.equals(task.getLastDeadlineAlert())) {
                continue;
            }
            TaskPatch patch = TaskPatch.builder()
                    .notify(new Notification(
                            tier.get().describe(task.getTitle(), task.getDueDate(), clock),
                            tier.get().level(),
                            clock.instant()))
                    .deadlineAlert(alert)
                    .build();
            boolean updated = store.updateIf(task.getId(), current -> !current.getStatus().isTerminal()
                    && Objects.equals(current.getDueDate(), task.getDueDate())
                    && !alert.equals(current.getLastDeadlineAlert()), patch);
            if (updated) {
                written++;
                log.debug("Deadline alert taskId={} tier={}", task.getId(), tier.get());
            }
        }
        return written;
    }
}
