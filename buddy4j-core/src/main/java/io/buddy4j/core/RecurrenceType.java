package io.buddy4j.core;

/**
 * Recurrence units. Months and years are approximated as 30 and 365 days.
 */
public enum RecurrenceType {
    NONE(0),
    DAILY(1),
    WEEKLY(7),
    MONTHLY(30),
    YEARLY(365);

    private final int days;

    RecurrenceType(int days) {
        this.days = days;
    }

    public int days() {
        return days;
    }
}
