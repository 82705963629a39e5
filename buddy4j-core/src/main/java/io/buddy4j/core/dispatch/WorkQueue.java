package io.buddy4j.core.dispatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Unbounded FIFO of work items. Many producers, one consumer.
 */
public class WorkQueue {

    private final LinkedBlockingQueue<WorkItem> items = new LinkedBlockingQueue<>();

    public void enqueue(WorkItem item) {
        items.add(Objects.requireNonNull(item, "item must not be null"));
    }

    /**
     * Blocks until an item is available.
     *
     * @throws InterruptedException when the consumer is interrupted, e.g. on shutdown
     */
    public WorkItem dequeue() throws InterruptedException {
        return items.take();
    }

    public int size() {
        return items.size();
    }

    /**
     * Removes and returns everything still queued.
     */
    public List<WorkItem> drain() {
        List<WorkItem> drained = new ArrayList<>();
        items.drainTo(drained);
        return drained;
    }
}
