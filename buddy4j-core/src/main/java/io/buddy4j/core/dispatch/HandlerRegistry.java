package io.buddy4j.core.dispatch;

import io.buddy4j.TaskHandler;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Fixed set of handlers plus their busy/idle state.
 *
 * <p>{@link #tryAcquire(String)} is the only way to move a handler from idle to busy; the check and the
 * flip happen under one lock, so two callers can never both own the same handler.
 */
public class HandlerRegistry {

    private final Map<String, TaskHandler> handlersByName;
    private final Set<String> busy = new HashSet<>();
    private final ReentrantLock lock = new ReentrantLock();

    public HandlerRegistry(List<? extends TaskHandler> handlers) {
        this.handlersByName = handlers.stream()
                .collect(Collectors.toMap(
                        TaskHandler::name,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate TaskHandler name: " + a.name());
                        },
                        LinkedHashMap::new
                ));
    }

    public TaskHandler getRequired(String name) {
        TaskHandler handler = handlersByName.get(name);
        if (handler == null) {
            throw new IllegalStateException("No TaskHandler registered for name: " + name);
        }
        return handler;
    }

    public boolean contains(String name) {
        return name != null && handlersByName.containsKey(name);
    }

    public Set<String> names() {
        return Set.copyOf(handlersByName.keySet());
    }

    /**
     * Marks the handler busy if it is idle.
     *
     * @return true if the caller now owns the handler and must {@link #release(String)} it
     */
    public boolean tryAcquire(String name) {
        getRequired(name);
        lock.lock();
        try {
            return busy.add(name);
        } finally {
            lock.unlock();
        }
    }

    public void release(String name) {
        lock.lock();
        try {
            busy.remove(name);
        } finally {
            lock.unlock();
        }
    }

    public boolean isBusy(String name) {
        lock.lock();
        try {
            return busy.contains(name);
        } finally {
            lock.unlock();
        }
    }

    public Map<String, HandlerState> states() {
        lock.lock();
        try {
            Map<String, HandlerState> states = new TreeMap<>();
            handlersByName.keySet().forEach(n -> states.put(n, busy.contains(n) ? HandlerState.BUSY : HandlerState.IDLE));
            return states;
        } finally {
            lock.unlock();
        }
    }
}
