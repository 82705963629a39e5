package io.buddy4j.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskStatusTest {

    @Test
    void terminalStatusesAllowNoExit() {
        for (TaskStatus target : TaskStatus.values()) {
            if (target != TaskStatus.COMPLETED) {
                assertFalse(TaskStatus.COMPLETED.canTransitionTo(target), "completed -> " + target);
            }
            if (target != TaskStatus.CANCELLED) {
                assertFalse(TaskStatus.CANCELLED.canTransitionTo(target), "cancelled -> " + target);
            }
        }
        assertTrue(TaskStatus.COMPLETED.isTerminal());
        assertTrue(TaskStatus.CANCELLED.isTerminal());
    }

    @Test
    void sameStatusIsAlwaysAllowed() {
        for (TaskStatus status : TaskStatus.values()) {
            assertTrue(status.canTransitionTo(status));
        }
    }

    @Test
    void inProgressCanFallBackToPendingButBlockedCannotComplete() {
        assertTrue(TaskStatus.IN_PROGRESS.canTransitionTo(TaskStatus.PENDING));
        assertTrue(TaskStatus.BLOCKED.canTransitionTo(TaskStatus.PENDING));
        assertFalse(TaskStatus.BLOCKED.canTransitionTo(TaskStatus.COMPLETED));
        assertFalse(TaskStatus.PENDING.canTransitionTo(TaskStatus.REVIEW));
    }

    @Test
    void labelIsLowerCase() {
        assertEquals("in_progress", TaskStatus.IN_PROGRESS.label());
    }
}
