package io.buddy4j.core;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Task status state machine.
 *
 * <p>{@link #COMPLETED} and {@link #CANCELLED} are terminal. Moving a task to the status it already
 * has is always allowed and treated as a no-op.
 */
public enum TaskStatus {
    PENDING {
        @Override
        Set<TaskStatus> next() {
            return EnumSet.of(IN_PROGRESS, COMPLETED, BLOCKED, ON_HOLD, CANCELLED);
        }
    },
    IN_PROGRESS {
        @Override
        Set<TaskStatus> next() {
            return EnumSet.of(COMPLETED, BLOCKED, ON_HOLD, CANCELLED, REVIEW, PENDING);
        }
    },
    BLOCKED {
        @Override
        Set<TaskStatus> next() {
            return EnumSet.of(PENDING, IN_PROGRESS, CANCELLED);
        }
    },
    ON_HOLD {
        @Override
        Set<TaskStatus> next() {
            return EnumSet.of(IN_PROGRESS, PENDING, CANCELLED);
        }
    },
    REVIEW {
        @Override
        Set<TaskStatus> next() {
            return EnumSet.of(COMPLETED, IN_PROGRESS, CANCELLED);
        }
    },
    COMPLETED {
        @Override
        Set<TaskStatus> next() {
            return EnumSet.noneOf(TaskStatus.class);
        }
    },
    CANCELLED {
        @Override
        Set<TaskStatus> next() {
            return EnumSet.noneOf(TaskStatus.class);
        }
    };

    abstract Set<TaskStatus> next();

    public boolean canTransitionTo(TaskStatus target) {
        return target == this || next().contains(target);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /**
     * Lower-case name used in notifications and readiness messages, e.g. {@code in_progress}.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
