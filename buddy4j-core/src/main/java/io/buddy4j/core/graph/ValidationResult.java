package io.buddy4j.core.graph;

import java.util.List;

/**
 * Outcome of a dependency graph check.
 *
 * @param cycleDetected whether at least one of {@code errors} reports a cycle
 */
public record ValidationResult(boolean ok, List<String> errors, boolean cycleDetected) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    static ValidationResult of(List<String> errors, boolean cycleDetected) {
        return new ValidationResult(errors.isEmpty(), errors, cycleDetected);
    }
}
