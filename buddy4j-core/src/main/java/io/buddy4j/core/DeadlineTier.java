package io.buddy4j.core;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Due-date tiers reported by the deadline sweep, computed with day granularity in the clock's zone.
 */
public enum DeadlineTier {
    OVERDUE(NotificationLevel.CRITICAL),
    DUE_TODAY(NotificationLevel.WARNING),
    DUE_TOMORROW(NotificationLevel.INFO);

    private final NotificationLevel level;

    DeadlineTier(NotificationLevel level) {
        this.level = level;
    }

    public NotificationLevel level() {
        return level;
    }

    public String describe(String title, Instant dueDate, Clock clock) {
        return switch (this) {
            case OVERDUE -> "Task '" + title + "' is overdue (was due " + dueDay(dueDate, clock) + ")";
            case DUE_TODAY -> "Task '" + title + "' is due today";
            case DUE_TOMORROW -> "Task '" + title + "' is due tomorrow";
        };
    }

    public static Optional<DeadlineTier> classify(Instant dueDate, Clock clock) {
        if (dueDate == null) {
            return Optional.empty();
        }
        long days = daysUntil(dueDate, clock);
        if (days < 0) {
            return Optional.of(OVERDUE);
        }
        if (days == 0) {
            return Optional.of(DUE_TODAY);
        }
        if (days == 1) {
            return Optional.of(DUE_TOMORROW);
        }
        return Optional.empty();
    }

    /**
     * Calendar days from today to the due date's day; negative when overdue.
     */
    public static long daysUntil(Instant dueDate, Clock clock) {
        return ChronoUnit.DAYS.between(LocalDate.now(clock), dueDay(dueDate, clock));
    }

    private static LocalDate dueDay(Instant dueDate, Clock clock) {
        return LocalDate.ofInstant(dueDate, clock.getZone());
    }
}
