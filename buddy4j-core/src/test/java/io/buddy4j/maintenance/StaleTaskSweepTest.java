package io.buddy4j.maintenance;

import io.buddy4j.core.Notification;
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
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class StaleTaskSweepTest {

    @TempDir
    Path dir;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-10T09:00:00Z"));
    private JsonFileTaskStore store;
    private StaleTaskSweep sweep;

    @BeforeEach
    void setUp() {
        store = TestStores.openFileStore(dir, clock);
        sweep = new StaleTaskSweep(store, clock, Duration.ofDays(3));
    }

    @Test
    void flagsOncePerIdleStretch() {
        String id = store.create(new Task("Write report")).getId();
        store.update(id, TaskPatch.status(TaskStatus.IN_PROGRESS));

        clock.advance(Duration.ofDays(2));
        assertEquals(0, sweep.run());

        clock.advance(Duration.ofDays(2));
        assertEquals(1, sweep.run());
        List<Notification> notes = store.getRequired(id).getNotifications();
        assertEquals(1, notes.size());
        assertEquals(NotificationLevel.WARNING, notes.get(0).level());
        assertEquals("Task 'Write report' has been in progress without activity for 4 days", notes.get(0).message());

        clock.advance(Duration.ofDays(1));
        assertEquals(0, sweep.run(), "already flagged for this stretch");

        store.update(id, TaskPatch.builder().progress(40).build());
        clock.advance(Duration.ofDays(4));

        assertEquals(1, sweep.run(), "work started a new stretch");
        assertEquals(2, store.getRequired(id).getNotifications().size());
    }

    @Test
    void onlyInProgressTasksAreConsidered() {
        String pending = store.create(new Task("Someday")).getId();
        clock.advance(Duration.ofDays(10));

        assertEquals(0, sweep.run());
        assertEquals(0, store.getRequired(pending).getNotifications().size());
    }
}
