package io.buddy4j.core;

import java.time.Clock;
import java.util.Collection;

/**
 * Summary counters over a set of tasks.
 *
 * @param completionRate completed / total in percent, rounded to one decimal; 0 for an empty store
 */
public record TaskStats(
        int total,
        int completed,
        int pending,
        int inProgress,
        int blocked,
        int overdue,
        int highPriorityOpen,
        double completionRate
) {

    public static TaskStats of(Collection<Task> tasks, Clock clock) {
        int completed = 0;
        int pending = 0;
        int inProgress = 0;
        int blocked = 0;
        int overdue = 0;
        int highPriorityOpen = 0;
        for (Task task : tasks) {
            switch (task.getStatus()) {
                case COMPLETED -> completed++;
                case PENDING -> pending++;
                case IN_PROGRESS -> inProgress++;
                case BLOCKED -> blocked++;
                default -> {
                }
            }
            if (task.getStatus().isTerminal()) {
                continue;
            }
            if (task.getDueDate() != null && DeadlineTier.daysUntil(task.getDueDate(), clock) < 0) {
                overdue++;
            }
            if (task.getPriority().rank() <= Priority.HIGH.rank()) {
                highPriorityOpen++;
            }
        }
        int total = tasks.size();
        double rate = total == 0 ? 0.0 : Math.round(completed * 1000.0 / total) / 10.0;
        return new TaskStats(total, completed, pending, inProgress, blocked, overdue, highPriorityOpen, rate);
    }
}
