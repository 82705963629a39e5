package io.buddy4j.maintenance;

import io.buddy4j.core.Recurrence;
import io.buddy4j.core.RecurrenceType;
import io.buddy4j.core.Task;
import io.buddy4j.core.TaskPatch;
import io.buddy4j.core.TaskStatus;
import io.buddy4j.core.recurrence.RecurrenceMaterializer;
import io.buddy4j.internal.file.JsonFileTaskStore;
import io.buddy4j.support.MutableClock;
import io.buddy4j.support.TestStores;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RecurrenceSweepTest {

    @TempDir
    Path dir;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-10T09:00:00Z"));

    @Test
    void createsOneInstancePerDueOccurrence() {
        JsonFileTaskStore store = TestStores.openFileStore(dir, clock);
        RecurrenceSweep sweep = new RecurrenceSweep(store, new RecurrenceMaterializer(store, clock));

        Task draft = new Task("Stand-up notes");
        draft.setDueDate(Instant.parse("2026-03-09T08:00:00Z"));
        draft.setRecurrence(Recurrence.every(1, RecurrenceType.DAILY));
        String id = store.create(draft).getId();
        store.update(id, TaskPatch.status(TaskStatus.COMPLETED));

        assertEquals(1, sweep.run());
        assertEquals(0, sweep.run());
        assertEquals(2, store.list().size());

        clock.advance(Duration.ofDays(1));

        assertEquals(1, sweep.run());
        assertEquals(3, store.list().size());
    }

    @Test
    void lateCompletionProducesOneInstanceNotOnePerMissedDay() {
        JsonFileTaskStore store = TestStores.openFileStore(dir, clock);
        RecurrenceSweep sweep = new RecurrenceSweep(store, new RecurrenceMaterializer(store, clock));

        Task draft = new Task("Stand-up notes");
        draft.setDueDate(Instant.parse("2026-02-28T08:00:00Z"));
        draft.setRecurrence(Recurrence.every(1, RecurrenceType.DAILY));
        String id = store.create(draft).getId();
        store.update(id, TaskPatch.status(TaskStatus.COMPLETED));

        int created = 0;
        for (int i = 0; i < 5; i++) {
            created += sweep.run();
        }

        assertEquals(1, created);
        long overdue = store.list().stream()
                .filter(t -> id.equals(t.getRecurrenceOf()))
                .filter(t -> t.getDueDate().isBefore(Instant.parse("2026-03-10T00:00:00Z")))
                .count();
        assertEquals(0, overdue);
    }
}
