package io.buddy4j.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskPatchTest {

    @Test
    void fullProgressForcesCompletion() {
        Task task = new Task("write tests");
        task.setStatus(TaskStatus.ON_HOLD);

        TaskPatch.builder().progress(100).build().applyTo(task);

        assertEquals(TaskStatus.COMPLETED, task.getStatus());
        assertEquals(100, task.getProgress());
    }

    @Test
    void cancelledTaskCannotReachFullProgress() {
        Task task = new Task("abandoned");
        TaskPatch patch = TaskPatch.builder().status(TaskStatus.CANCELLED).progress(100).build();

        assertThrows(TaskValidationException.class, () -> patch.applyTo(task));
    }

    @Test
    void illegalTransitionIsRejected() {
        Task task = new Task("done");
        task.setStatus(TaskStatus.COMPLETED);

        TaskValidationException ex = assertThrows(TaskValidationException.class,
                () -> TaskPatch.status(TaskStatus.PENDING).applyTo(task));
        assertTrue(ex.getMessage().contains("completed -> pending"));
    }

    @Test
    void settingTheSameStatusIsANoOp() {
        Task task = new Task("done");
        task.setStatus(TaskStatus.COMPLETED);

        TaskPatch.status(TaskStatus.COMPLETED).applyTo(task);

        assertEquals(TaskStatus.COMPLETED, task.getStatus());
    }

    @Test
    void progressOutsideRangeAndBlankTitleAreRejected() {
        Task task = new Task("t");
        assertThrows(TaskValidationException.class, () -> TaskPatch.builder().progress(101).build().applyTo(task));
        assertThrows(TaskValidationException.class, () -> TaskPatch.builder().progress(-1).build().applyTo(task));
        assertThrows(TaskValidationException.class, () -> TaskPatch.builder().title("  ").build().applyTo(task));
    }

    @Test
    void recurrenceChangeRecomputesNextOccurrence() {
        Task task = new Task("water plants");
        task.setDueDate(Instant.parse("2026-03-10T08:00:00Z"));

        TaskPatch.builder().recurrence(Recurrence.every(2, RecurrenceType.WEEKLY)).build().applyTo(task);
        assertEquals(Instant.parse("2026-03-24T08:00:00Z"), task.getNextOccurrence());

        TaskPatch.builder().recurrence(Recurrence.none()).build().applyTo(task);
        assertNull(task.getNextOccurrence());
    }

    @Test
    void bookkeepingPatchDoesNotCountAsWork() {
        TaskPatch note = TaskPatch.builder()
                .notify(new Notification("heads up", NotificationLevel.INFO, Instant.EPOCH))
                .build();

        assertFalse(note.touchesWork());
        assertFalse(note.isEmpty());
        assertTrue(TaskPatch.builder().priority(Priority.HIGH).build().touchesWork());
        assertTrue(TaskPatch.empty().isEmpty());
    }

    @Test
    void nonPositiveRecurrenceIntervalIsRejected() {
        assertThrows(TaskValidationException.class, () -> Recurrence.every(0, RecurrenceType.DAILY));
    }
}
