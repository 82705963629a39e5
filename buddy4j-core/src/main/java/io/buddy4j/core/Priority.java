package io.buddy4j.core;

/**
 * Static task priority. Lower rank means more urgent.
 */
public enum Priority {

    CRITICAL(0),
    HIGH(1),
    MEDIUM(2),
    LOW(3);

    private final int rank;

    Priority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }
}
