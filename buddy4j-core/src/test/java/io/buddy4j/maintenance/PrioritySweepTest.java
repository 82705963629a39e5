package io.buddy4j.maintenance;

import io.buddy4j.core.PriorityScorer;
import io.buddy4j.core.Task;
import io.buddy4j.core.TaskFilter;
import io.buddy4j.core.TaskPatch;
import io.buddy4j.internal.file.JsonFileTaskStore;
import io.buddy4j.store.TaskStore;
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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PrioritySweepTest {

    @TempDir
    Path dir;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-10T09:00:00Z"));
    private JsonFileTaskStore store;
    private PrioritySweep sweep;

    @BeforeEach
    void setUp() {
        store = TestStores.openFileStore(dir, clock);
        sweep = new PrioritySweep(store, new PriorityScorer(clock));
    }

    @Test
    void rewritesOnlyScoresThatDrifted() {
        Task draft = new Task("Renew passport");
        draft.setDueDate(Instant.parse("2026-03-20T09:00:00Z"));
        String dated = store.create(draft).getId();
        String undated = store.create(new Task("Read a book")).getId();
        assertEquals(1.0, store.getRequired(dated).getDynamicPriorityScore());

        assertEquals(0, sweep.run());

        clock.advance(Duration.ofDays(8));
        long undatedRevision = store.getRequired(undated).getRevision();

        assertEquals(1, sweep.run());
        assertEquals(2.5, store.getRequired(dated).getDynamicPriorityScore());
        assertEquals(undatedRevision, store.getRequired(undated).getRevision());
        assertEquals(0, sweep.run());
    }

    @Test
    void writesLostToAConcurrentUpdateAreNotCounted() {
        TaskStore mockStore = mock(TaskStore.class);
        Task drifted = new Task("Renew passport");
        drifted.setId("t-1");
        drifted.setDynamicPriorityScore(-5);
        when(mockStore.list(any(TaskFilter.class))).thenReturn(List.of(drifted));
        when(mockStore.updateIf(eq("t-1"), any(), any(TaskPatch.class))).thenReturn(false);

        assertEquals(0, new PrioritySweep(mockStore, new PriorityScorer(clock)).run());
        verify(mockStore).updateIf(eq("t-1"), any(), any(TaskPatch.class));
    }
}
