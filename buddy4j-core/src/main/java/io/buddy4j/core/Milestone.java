package io.buddy4j.core;

import java.util.Objects;

public record Milestone(String title, boolean completed) {

    public Milestone {
        Objects.requireNonNull(title, "title must not be null");
    }

    public static Milestone open(String title) {
        return new Milestone(title, false);
    }

    public Milestone reset() {
        return completed ? new Milestone(title, false) : this;
    }
}
