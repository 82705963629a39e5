package io.buddy4j.core.dispatch;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class InteractionLogTest {

    @Test
    void keepsMostRecentEntriesFirstUpToCapacity() {
        InteractionLog log = new InteractionLog(3);
        for (int i = 1; i <= 5; i++) {
            log.record(new Interaction("q" + i, "general_chat", "r" + i, null, true, Instant.EPOCH.plusSeconds(i)));
        }

        assertEquals(3, log.size());
        assertEquals(List.of("q5", "q4"), log.recent(2).stream().map(Interaction::query).toList());
        assertEquals(List.of("q5", "q4", "q3"), log.recent(10).stream().map(Interaction::query).toList());
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new InteractionLog(0));
    }

    @Test
    void workQueueIsFifo() throws InterruptedException {
        WorkQueue queue = new WorkQueue();
        queue.enqueue(WorkItem.of("first"));
        queue.enqueue(WorkItem.forTask("t-1", "second"));

        assertEquals("first", queue.dequeue().query());
        assertEquals("t-1", queue.dequeue().taskId());
        assertEquals(0, queue.size());
    }
}
