package io.buddy4j.core.graph;

import java.util.List;

/**
 * Whether a task may start.
 *
 * @param blocking one entry per unfinished dependency, formatted {@code "<title> (<status>)"}, or
 *                 {@code "<id> (missing)"} for dependencies that no longer exist
 */
public record Readiness(boolean ready, List<String> blocking) {

    public Readiness {
        blocking = List.copyOf(blocking);
    }
}
