package io.buddy4j.maintenance;

import io.buddy4j.core.DeadlineAlert;
import io.buddy4j.core.DeadlineTier;
import io.buddy4j.core.NotificationLevel;
import io.buddy4j.core.Task;
import io.buddy4j.core.TaskPatch;
import io.buddy4j.core.TaskStatus;
import io.buddy4j.internal.file.JsonFileTaskStore;
import io.buddy4j.support.MutableClock;
import io.buddy4j.support.TestStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeadlineSweepTest {

    @TempDir
    Path dir;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-10T09:00:00Z"));
    private JsonFileTaskStore store;
    private DeadlineSweep sweep;

    @BeforeEach
    void setUp() {
        store = TestStores.openFileStore(dir, clock);
        sweep = new DeadlineSweep(store, clock);
    }

    @Test
    void alertsOncePerTaskTierAndDay() {
        String overdue = create("File taxes", Instant.parse("2026-03-09T12:00:00Z"));
        String today = create("Call plumber", Instant.parse("2026-03-10T18:00:00Z"));
        String tomorrow = create("Pay rent", Instant.parse("2026-03-11T10:00:00Z"));
        String later = create("Book flights", Instant.parse("2026-03-20T10:00:00Z"));

        assertEquals(3, sweep.run());
        assertEquals(0, sweep.run(), "second run on the same day writes nothing");

        Task overdueTask = store.getRequired(overdue);
        assertEquals(1, overdueTask.getNotifications().size());
        assertEquals(NotificationLevel.CRITICAL, overdueTask.getNotifications().get(0).level());
        assertTrue(overdueTask.getNotifications().get(0).message().startsWith("Task 'File taxes' is overdue"));
        assertEquals(new DeadlineAlert(DeadlineTier.OVERDUE, LocalDate.of(2026, 3, 10)), overdueTask.getLastDeadlineAlert());
        assertEquals("Task 'Call plumber' is due today", store.getRequired(today).getNotifications().get(0).message());
        assertEquals(NotificationLevel.INFO, store.getRequired(tomorrow).getNotifications().get(0).level());
        assertTrue(store.getRequired(later).getNotifications().isEmpty());

        clock.advance(Duration.ofDays(1));

        assertEquals(3, sweep.run(), "a new day re-evaluates every tier");
        assertEquals(2, store.getRequired(overdue).getNotifications().size());
        assertEquals(DeadlineTier.OVERDUE, store.getRequired(today).getLastDeadlineAlert().tier());
        assertEquals(DeadlineTier.DUE_TODAY, store.getRequired(tomorrow).getLastDeadlineAlert().tier());
    }

    @Test
    void terminalTasksAreIgnored() {
        String id = create("Old chore", Instant.parse("2026-03-01T12:00:00Z"));
        store.update(id, TaskPatch.status(TaskStatus.COMPLETED));

        assertEquals(0, sweep.run());
        assertTrue(store.getRequired(id).getNotifications().isEmpty());
    }

    @Test
    void alertsDoNotCountAsWork() {
        String id = create("File taxes", Instant.parse("2026-03-09T12:00:00Z"));
        Instant before = store.getRequired(id).getLastActivityAt();
        clock.advance(Duration.ofMinutes(5));

        sweep.run();

        assertEquals(before, store.getRequired(id).getLastActivityAt());
    }

    private String create(String title, Instant due) {
        Task draft = new Task(title);
        draft.setDueDate(due);
        return store.create(draft).getId();
    }
}
