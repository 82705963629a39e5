package io.buddy4j.core;

/**
 * Subtask proposal returned by a {@link io.buddy4j.GoalDecomposer}.
 */
public record SubtaskDraft(String title, String description) {

    public static SubtaskDraft of(String title) {
        return new SubtaskDraft(title, "");
    }

    public boolean isUsable() {
        return title != null && !title.isBlank();
    }
}
