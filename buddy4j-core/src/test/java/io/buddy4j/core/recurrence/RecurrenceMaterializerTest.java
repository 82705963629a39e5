package io.buddy4j.core.recurrence;

import io.buddy4j.core.Milestone;
import io.buddy4j.core.Priority;
import io.buddy4j.core.Recurrence;
import io.buddy4j.core.RecurrenceType;
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
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecurrenceMaterializerTest {

    private static final Instant NOW = Instant.parse("2026-03-10T09:00:00Z");

    @TempDir
    Path dir;

    private final MutableClock clock = new MutableClock(NOW);
    private JsonFileTaskStore store;
    private RecurrenceMaterializer materializer;

    @BeforeEach
    void setUp() {
        store = TestStores.openFileStore(dir, clock);
        materializer = new RecurrenceMaterializer(store, clock);
    }

    @Test
    void nextOccurrenceAddsTheIntervalToTheDueDate() {
        Task weekly = new Task("Team sync");
        weekly.setDueDate(Instant.parse("2026-03-02T10:00:00Z"));
        weekly.setRecurrence(Recurrence.every(2, RecurrenceType.WEEKLY));
        assertEquals(Optional.of(Instant.parse("2026-03-16T10:00:00Z")), materializer.nextOccurrence(weekly));

        Task yearly = new Task("Renew passport");
        yearly.setUpdatedAt(NOW);
        yearly.setRecurrence(Recurrence.every(1, RecurrenceType.YEARLY));
        assertEquals(Optional.of(NOW.plusSeconds(365L * 86400)), materializer.nextOccurrence(yearly));

        assertTrue(materializer.nextOccurrence(new Task("One-off")).isEmpty());
    }

    @Test
    void completedRecurringTaskMaterializesItsNextOccurrence() {
        Task origin = completedDailyTask();

        Optional<Task> created = materializer.materialize(store.getRequired(origin.getId()));

        assertTrue(created.isPresent());
        Task instance = created.get();
        assertEquals(TaskStatus.PENDING, instance.getStatus());
        assertEquals(Instant.parse("2026-03-10T08:00:00Z"), instance.getDueDate());
        assertEquals(origin.getId(), instance.getRecurrenceOf());
        assertEquals(Priority.HIGH, instance.getPriority());
        assertEquals("chores", instance.getAssignedHandler());
        assertEquals(Set.of("home"), instance.getTags());
        assertEquals(List.of(new Milestone("Fill can", false)), instance.getMilestones());
        assertEquals(0, instance.getProgress());

        Task advanced = store.getRequired(origin.getId());
        assertEquals(Instant.parse("2026-03-11T08:00:00Z"), advanced.getNextOccurrence());
        assertFalse(materializer.isDue(advanced));
    }

    @Test
    void seriesThatFellBehindIsCaughtUpByOneInstance() {
        Task draft = new Task("Water plants");
        draft.setDueDate(Instant.parse("2026-02-28T08:00:00Z"));
        draft.setRecurrence(Recurrence.every(1, RecurrenceType.DAILY));
        Task origin = store.create(draft);
        store.update(origin.getId(), TaskPatch.status(TaskStatus.COMPLETED));

        Task instance = materializer.materialize(store.getRequired(origin.getId())).orElseThrow();

        assertEquals(Instant.parse("2026-03-10T08:00:00Z"), instance.getDueDate());
        Task advanced = store.getRequired(origin.getId());
        assertEquals(Instant.parse("2026-03-11T08:00:00Z"), advanced.getNextOccurrence());
        assertFalse(materializer.isDue(advanced));
        assertTrue(materializer.materialize(advanced).isEmpty());
        assertEquals(1, instancesOf(origin.getId()));
    }

    @Test
    void staleSnapshotCannotClaimTheSameOccurrenceTwice() {
        Task origin = completedDailyTask();
        Task snapshot = store.getRequired(origin.getId());

        assertTrue(materializer.materialize(snapshot).isPresent());
        assertTrue(materializer.materialize(snapshot).isEmpty());
        assertEquals(1, instancesOf(origin.getId()));
    }

    @Test
    void concurrentAttemptsProduceExactlyOneInstance() throws Exception {
        Task origin = completedDailyTask();
        Task snapshot = store.getRequired(origin.getId());
        int threads = 6;
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            Callable<Boolean> attempt = () -> {
                go.await();
                return materializer.materialize(snapshot).isPresent();
            };
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(attempt));
            }
            go.countDown();
            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, instancesOf(origin.getId()));
    }

    @Test
    void materializedInstancesDoNotDriveTheSeries() {
        Task origin = completedDailyTask();
        Task instance = materializer.materialize(store.getRequired(origin.getId())).orElseThrow();
        store.update(instance.getId(), TaskPatch.status(TaskStatus.COMPLETED));
        clock.set(Instant.parse("2026-03-20T00:00:00Z"));

        assertTrue(materializer.materialize(store.getRequired(instance.getId())).isEmpty());
    }

    @Test
    void notYetDueOrNotCompletedTasksAreLeftAlone() {
        Task draft = new Task("Water plants");
        draft.setDueDate(Instant.parse("2026-03-12T08:00:00Z"));
        draft.setRecurrence(Recurrence.every(1, RecurrenceType.DAILY));
        Task pending = store.create(draft);

        assertTrue(materializer.materialize(pending).isEmpty());
        store.update(pending.getId(), TaskPatch.status(TaskStatus.COMPLETED));
        assertTrue(materializer.materialize(store.getRequired(pending.getId())).isEmpty());
        assertNull(store.getRequired(pending.getId()).getRecurrenceOf());
    }

    private Task completedDailyTask() {
        Task draft = new Task("Water plants");
        draft.setPriority(Priority.HIGH);
        draft.setAssignedHandler("chores");
        draft.setTags(Set.of("home"));
        draft.setMilestones(List.of(new Milestone("Fill can", true)));
        draft.setDueDate(Instant.parse("2026-03-09T08:00:00Z"));
        draft.setRecurrence(Recurrence.every(1, RecurrenceType.DAILY));
        Task created = store.create(draft);
        store.update(created.getId(), TaskPatch.status(TaskStatus.COMPLETED));
        return store.getRequired(created.getId());
    }

    private long instancesOf(String originId) {
        return store.list().stream().filter(t -> originId.equals(t.getRecurrenceOf())).count();
    }
}
