package io.buddy4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClients;
import io.buddy4j.core.DeadlineAlert;
import io.buddy4j.core.DeadlineTier;
import io.buddy4j.core.DependencyCycleException;
import io.buddy4j.core.Milestone;
import io.buddy4j.core.Notification;
import io.buddy4j.core.NotificationLevel;
import io.buddy4j.core.Priority;
import io.buddy4j.core.PriorityScorer;
import io.buddy4j.core.Recurrence;
import io.buddy4j.core.RecurrenceType;
import io.buddy4j.core.Task;
import io.buddy4j.core.TaskFilter;
import io.buddy4j.core.TaskPatch;
import io.buddy4j.core.TaskStatus;
import io.buddy4j.core.graph.DependencyGraphValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoTaskStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    @TempDir
    Path dir;

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-10T09:00:00Z"), ZoneOffset.UTC);
    private MongoTemplate mongoTemplate;
    private MongoTaskStore store;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "buddy4j_test");
        mongoTemplate.dropCollection(TaskDocument.class);
        store = new MongoTaskStore(mongoTemplate, new ObjectMapper(), clock, new PriorityScorer(clock));
        store.open();
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(TaskDocument.class);
    }

    @Test
    void nestedValuesSurviveRoundTrip() {
        Task draft = new Task("Water plants");
        draft.setPriority(Priority.HIGH);
        draft.setDueDate(Instant.parse("2026-03-11T08:00:00Z"));
        draft.setRecurrence(Recurrence.every(2, RecurrenceType.WEEKLY));
        draft.setTags(Set.of("home"));
        draft.setMilestones(List.of(Milestone.open("Fill can")));
        String id = store.create(draft).getId();

        DeadlineAlert alert = new DeadlineAlert(DeadlineTier.DUE_TOMORROW, LocalDate.of(2026, 3, 10));
        store.update(id, TaskPatch.builder()
                .notify(new Notification("Task 'Water plants' is due tomorrow", NotificationLevel.INFO, clock.instant()))
                .deadlineAlert(alert)
                .build());

        Task loaded = store.getRequired(id);
        assertEquals(Priority.HIGH, loaded.getPriority());
        assertEquals(Recurrence.every(2, RecurrenceType.WEEKLY), loaded.getRecurrence());
        assertEquals(Instant.parse("2026-03-25T08:00:00Z"), loaded.getNextOccurrence());
        assertEquals(List.of(Milestone.open("Fill can")), loaded.getMilestones());
        assertEquals(NotificationLevel.INFO, loaded.getNotifications().get(0).level());
        assertEquals(clock.instant(), loaded.getNotifications().get(0).timestamp());
        assertEquals(alert, loaded.getLastDeadlineAlert());
        assertEquals(2, loaded.getRevision());
        assertEquals(Set.of("home"), loaded.getTags());
    }

    @Test
    void staleRevisionReplacesNothing() {
        Task created = store.create(new Task("Plan trip"));
        Task stale = created.copy();
        store.update(created.getId(), TaskPatch.builder().progress(10).build());

        stale.setTitle("Overwritten");
        stale.setRevision(created.getRevision() + 1);
        assertFalse(store.replace(stale, created.getRevision()));
        assertEquals("Plan trip", store.getRequired(created.getId()).getTitle());
    }

    @Test
    void concurrentUpdatesAreAllApplied() throws Exception {
        String id = store.create(new Task("Collect receipts")).getId();
        int writers = 5;
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                String tag = "receipt-" + i;
                Callable<Boolean> write = () -> {
                    go.await();
                    return store.update(id, TaskPatch.builder().notify(
                            new Notification(tag, NotificationLevel.INFO, clock.instant())).build());
                };
                results.add(pool.submit(write));
            }
            go.countDown();
            for (Future<Boolean> r : results) {
                assertTrue(r.get(10, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        Task loaded = store.getRequired(id);
        assertEquals(writers, loaded.getNotifications().size());
        assertEquals(1 + writers, loaded.getRevision());
    }

    @Test
    void filtersAreTranslatedToQueries() {
        Task a = store.create(new Task("Book venue"));
        Task draft = new Task("Send invites");
        draft.setDependencies(Set.of(a.getId()));
        draft.setTags(Set.of("party"));
        draft.setDueDate(Instant.parse("2026-03-12T10:00:00Z"));
        Task b = store.create(draft);
        store.update(a.getId(), TaskPatch.status(TaskStatus.COMPLETED));

        assertEquals(List.of(b.getId()), ids(store.list(TaskFilter.builder().dependsOn(a.getId()).build())));
        assertEquals(List.of(b.getId()), ids(store.list(TaskFilter.builder().excludeTerminal().build())));
        assertEquals(List.of(b.getId()), ids(store.list(TaskFilter.builder().tag("party")
                .dueBefore(Instant.parse("2026-03-13T00:00:00Z")).build())));
        assertEquals(List.of(a.getId()), ids(store.list(TaskFilter.builder()
                .status(TaskStatus.COMPLETED, TaskStatus.CANCELLED).build())));
        assertEquals(2, store.list().size());
    }

    @Test
    void cascadeDeleteAndCycleCheckWorkAgainstMongo() {
        Task parent = store.create(new Task("Move house"));
        Task child = new Task("Pack boxes");
        child.setParentId(parent.getId());
        String childId = store.create(child).getId();
        Task other = new Task("Clean old flat");
        other.setDependencies(Set.of(childId));
        String otherId = store.create(other).getId();

        assertThrows(DependencyCycleException.class,
                () -> store.update(childId, TaskPatch.builder().addDependency(otherId).build()));

        assertTrue(store.delete(parent.getId()));
        assertTrue(store.get(childId).isEmpty());
        assertTrue(store.getRequired(otherId).getDependencies().isEmpty());
    }

    @Test
    void cycleClosedByTwoStoreInstancesIsRolledBack() throws Exception {
        CyclicBarrier bothWriting = new CyclicBarrier(2);
        MongoTaskStore first = racingStore(bothWriting);
        MongoTaskStore second = racingStore(bothWriting);
        String a = store.create(new Task("A")).getId();
        String b = store.create(new Task("B")).getId();

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Boolean> aOnB = pool.submit(() -> addEdge(first, a, b));
            Future<Boolean> bOnA = pool.submit(() -> addEdge(second, b, a));
            int persisted = (aOnB.get(10, TimeUnit.SECONDS) ? 1 : 0) + (bOnA.get(10, TimeUnit.SECONDS) ? 1 : 0);
            assertTrue(persisted <= 1);
        } finally {
            pool.shutdownNow();
        }

        DependencyGraphValidator graph = new DependencyGraphValidator(store::get);
        assertTrue(graph.validate(a).ok());
        assertTrue(graph.validate(b).ok());
    }

    @Test
    void backupAndRestoreReplaceTheCollection() {
        String kept = store.create(new Task("Keep me")).getId();
        Path backup = dir.resolve("backup.json");
        store.backup(backup);
        store.create(new Task("Added later"));

        store.restore(backup);

        assertEquals(List.of(kept), ids(store.list()));
    }

    private MongoTaskStore racingStore(CyclicBarrier barrier) {
        return new MongoTaskStore(mongoTemplate, new ObjectMapper(), clock, new PriorityScorer(clock)) {
            @Override
            protected boolean replace(Task task, long expectedRevision) {
                if (!task.getDependencies().isEmpty()) {
                    try {
                        barrier.await(2, TimeUnit.SECONDS);
                    } catch (TimeoutException | BrokenBarrierException e) {
                        barrier.reset();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return super.replace(task, expectedRevision);
            }
        };
    }

    private static boolean addEdge(MongoTaskStore target, String taskId, String dependsOnId) {
        try {
            return target.update(taskId, TaskPatch.builder().addDependency(dependsOnId).build());
        } catch (DependencyCycleException e) {
            return false;
        }
    }

    private static List<String> ids(List<Task> tasks) {
        return tasks.stream().map(Task::getId).toList();
    }
}
