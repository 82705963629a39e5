package io.buddy4j.core;

import java.time.Clock;
import java.util.Objects;

/**
 * Computes {@link Task#getDynamicPriorityScore()}.
 *
 * <pre>
 * score = (3 - rank)
 *       + due bonus (overdue 3, today 2, within 2 days 1.5, within 7 days 1)
 *       + 0.2 per subtask
 *       + status adjustment (blocked -1, in progress +0.5)
 * </pre>
 *
 * Days are counted between calendar dates in the clock's zone. The result is not clamped.
 */
public class PriorityScorer {

    private final Clock clock;

    public PriorityScorer(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public double score(Task task) {
        Objects.requireNonNull(task, "task must not be null");
        double base = 3 - task.getPriority().rank();
        return base + dueBonus(task) + 0.2 * task.getSubtasks().size() + statusAdjustment(task.getStatus());
    }

    private double dueBonus(Task task) {
        if (task.getDueDate() == null) {
            return 0;
        }
        long days = DeadlineTier.daysUntil(task.getDueDate(), clock);
        if (days < 0) {
            return 3;
        }
        if (days == 0) {
            return 2;
        }
        if (days <= 2) {
            return 1.5;
        }
        if (days <= 7) {
            return 1;
        }
        return 0;
    }

    private static double statusAdjustment(TaskStatus status) {
        return switch (status) {
            case BLOCKED -> -1;
            case IN_PROGRESS -> 0.5;
            default -> 0;
        };
    }
}
