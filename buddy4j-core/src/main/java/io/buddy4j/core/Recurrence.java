package io.buddy4j.core;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;

/**
 * How often a task repeats.
 *
 * @param type     recurrence unit
 * @param interval number of units between occurrences, always positive
 */
public record Recurrence(RecurrenceType type, int interval) {

    private static final Recurrence NONE = new Recurrence(RecurrenceType.NONE, 1);

    public Recurrence {
        if (type == null) {
            throw new TaskValidationException("recurrence type must not be null");
        }
        if (interval <= 0) {
            throw new TaskValidationException("recurrence interval must be positive: " + interval);
        }
    }

    public static Recurrence none() {
        return NONE;
    }

    public static Recurrence every(int interval, RecurrenceType type) {
        return new Recurrence(type, interval);
    }

    @JsonIgnore
    public boolean isRecurring() {
        return type != RecurrenceType.NONE;
    }

    /**
     * Adds one period to {@code base}. Returns {@code null} for non-recurring settings.
     */
    public Instant nextAfter(Instant base) {
        if (!isRecurring() || base == null) {
            return null;
        }
        return base.plus(Duration.ofDays((long) type.days() * interval));
    }
}
