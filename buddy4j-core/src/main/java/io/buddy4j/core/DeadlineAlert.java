package io.buddy4j.core;

import java.time.LocalDate;

/**
 * Marks the last deadline notification written for a task so a sweep does not repeat it on the same day.
 */
public record DeadlineAlert(DeadlineTier tier, LocalDate day) {
}
