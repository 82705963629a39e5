package io.buddy4j.core.dispatch;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Bounded, most-recent-first record of handler exchanges. Oldest entries fall off once full.
 */
public class InteractionLog {

    private final int capacity;
    private final Deque<Interaction> entries = new ArrayDeque<>();

    public InteractionLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
    }

    public synchronized void record(Interaction interaction) {
        entries.addFirst(Objects.requireNonNull(interaction, "interaction must not be null"));
        while (entries.size() > capacity) {
            entries.removeLast();
        }
    }

    public synchronized List<Interaction> recent(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        List<Interaction> out = new ArrayList<>(Math.min(limit, entries.size()));
        Iterator<Interaction> it = entries.iterator();
        while (it.hasNext() && out.size() < limit) {
            out.add(it.next());
        }
        return out;
    }

    public synchronized int size() {
        return entries.size();
    }
}
