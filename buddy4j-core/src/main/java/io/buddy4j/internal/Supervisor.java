package io.buddy4j.internal;

import io.buddy4j.Buddy;
import io.buddy4j.GoalDecomposer;
import io.buddy4j.IntentClassifier;
import io.buddy4j.TaskBuilder;
import io.buddy4j.TaskHandler;
import io.buddy4j.config.BuddyProperties;
import io.buddy4j.core.PriorityScorer;
import io.buddy4j.core.SubtaskDraft;
import io.buddy4j.core.Task;
import io.buddy4j.core.TaskFilter;
import io.buddy4j.core.TaskPatch;
import io.buddy4j.core.TaskStats;
import io.buddy4j.core.TaskStatus;
import io.buddy4j.core.TaskValidationException;
import io.buddy4j.core.dispatch.HandlerRegistry;
import io.buddy4j.core.dispatch.HandlerRequest;
import io.buddy4j.core.dispatch.HandlerResult;
import io.buddy4j.core.dispatch.HandlerState;
import io.buddy4j.core.dispatch.Interaction;
import io.buddy4j.core.dispatch.InteractionLog;
import io.buddy4j.core.dispatch.WorkItem;
import io.buddy4j.core.dispatch.WorkQueue;
import io.buddy4j.core.graph.DependencyGraphValidator;
import io.buddy4j.core.graph.Readiness;
import io.buddy4j.core.graph.ValidationResult;
import io.buddy4j.core.recurrence.RecurrenceMaterializer;
import io.buddy4j.logging.MdcContext;
import io.buddy4j.maintenance.DeadlineSweep;
import io.buddy4j.maintenance.MaintenancePass;
import io.buddy4j.maintenance.PrioritySweep;
import io.buddy4j.maintenance.RecurrenceSweep;
import io.buddy4j.maintenance.StaleTaskSweep;
import io.buddy4j.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Supervisor owns the work queue and hands requests to handlers.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>One dispatcher thread consumes the queue in FIFO order</li>
 *   <li>At most one active request per handler, enforced through the {@link HandlerRegistry}</li>
 *   <li>Handler calls run on a worker pool, so different handlers work concurrently</li>
 *   <li>Maintenance passes (deadlines, stale tasks, recurrences, priorities) run on their own timers</li>
 * </ul>
 *
 * <p>A busy handler is retried with a fixed backoff a bounded number of times; when the budget runs out
 * the referenced task is marked blocked and the request is dropped. Nothing thrown by a handler, the
 * classifier or the store escapes the dispatcher loop.
 */
public class Supervisor implements Buddy {
    private static final Logger log = LoggerFactory.getLogger(Supervisor.class);

    static final int MAX_SUBTASKS = 7;

    private final BuddyProperties props;
    private final TaskStore store;
    private final HandlerRegistry registry;
    private final IntentClassifier classifier;
    private final GoalDecomposer decomposer;
    private final PriorityScorer scorer;
    private final Clock clock;

    private final DependencyGraphValidator validator;
    private final TaskLifecycle lifecycle;
    private final List<MaintenancePass> passes;
    private final WorkQueue queue = new WorkQueue();
    private final InteractionLog interactions;

    private final AtomicBoolean started = new AtomicBoolean(false);
    // tasks owned by a work item between step 2 of dispatch and the end of the handler call
    private final Set<String> dispatching = ConcurrentHashMap.newKeySet();

    private ExecutorService workerPool;
    private ScheduledExecutorService watchdog;
    private Thread dispatcherThread;
    private PassScheduler passScheduler;

    public Supervisor(
            BuddyProperties props,
            TaskStore store,
            HandlerRegistry registry,
            IntentClassifier classifier,
            GoalDecomposer decomposer,
            PriorityScorer scorer,
            Clock clock
    ) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.decomposer = Objects.requireNonNull(decomposer, "decomposer must not be null");
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        this.validator = new DependencyGraphValidator(store::get);
        RecurrenceMaterializer materializer = new RecurrenceMaterializer(store, clock);
        this.lifecycle = new TaskLifecycle(store, validator, materializer, clock);
        this.interactions = new InteractionLog(props.getInteractionLogSize());
        this.passes = List.of(
                new DeadlineSweep(store, clock),
                new StaleTaskSweep(store, clock, props.getStaleThreshold()),
                new RecurrenceSweep(store, materializer),
                new PrioritySweep(store, scorer)
        );
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            props.validate();
            if (!registry.contains(props.getDefaultHandler())) {
                throw new IllegalStateException("Default handler is not registered: " + props.getDefaultHandler());
            }
            store.open();
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }

        log.info("Buddy starting with handlers={}, defaultHandler={}, acquireAttempts={}, acquireBackoff={}, workerThreads={}, handlerTimeout={}",
                registry.names(),
                props.getDefaultHandler(),
                props.getAcquireAttempts(),
                props.getAcquireBackoff(),
                props.getWorkerThreads(),
                props.getHandlerTimeout());

        workerPool = Executors.newFixedThreadPool(props.getWorkerThreads(), r -> {
            Thread t = new Thread(r);
            t.setName("buddy.worker");
            t.setDaemon(true);
            return t;
        });
        if (props.getHandlerTimeout() != null) {
            watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r);
                t.setName("buddy.watchdog");
                t.setDaemon(true);
                return t;
            });
        }

        dispatcherThread = new Thread(this::dispatchLoop);
        dispatcherThread.setName("buddy.dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();

        if (props.isSweepsEnabled()) {
            passScheduler = new PassScheduler(List.of(
                    new PassScheduler.ScheduledPass(passes.get(0), props.getDeadlineSweepEvery()),
                    new PassScheduler.ScheduledPass(passes.get(1), props.getStaleSweepEvery()),
                    new PassScheduler.ScheduledPass(passes.get(2), props.getRecurrenceSweepEvery()),
                    new PassScheduler.ScheduledPass(passes.get(3), props.getPrioritySweepEvery())
            ), props.sweepZone(), clock);
            passScheduler.start();
        }
        log.info("Buddy started successfully.");
    }

    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Buddy stopping...");
        Duration timeout = props.getShutdownTimeout();

        if (passScheduler != null) {
            passScheduler.stop(timeout);
            passScheduler = null;
        }

        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            try {
                dispatcherThread.join(timeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            dispatcherThread = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.error("Handler calls still running after {}; interrupting them", timeout);
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }

        if (watchdog != null) {
            watchdog.shutdownNow();
            watchdog = null;
        }

        List<WorkItem> abandoned = queue.drain();
        if (!abandoned.isEmpty()) {
            log.warn("Dropped {} queued work items on shutdown", abandoned.size());
        }
        log.info("Buddy stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    /* ================= task lifecycle ================= */

    @Override
    public TaskBuilder create(String title) {
        return new SimpleTaskBuilder(title, this::createTask);
    }

    private Task createTask(Task draft) {
        Task created = store.create(draft);
        log.info("Task created taskId={} title={}", created.getId(), created.getTitle());
        return created;
    }

    @Override
    public Optional<Task> get(String taskId) {
        return store.get(taskId);
    }

    @Override
    public List<Task> list(TaskFilter filter) {
        return store.list(filter);
    }

    @Override
    public boolean update(String taskId, TaskPatch patch) {
        boolean updated = store.update(taskId, patch);
        if (updated && patch.touchesDependencies()) {
            store.get(taskId).ifPresent(lifecycle::releaseIfReady);
        }
        return updated;
    }

    @Override
    public boolean delete(String taskId) {
        Map<String, Set<String>> blockedOn = new LinkedHashMap<>();
        for (Task blocked : store.list(TaskFilter.builder().status(TaskStatus.BLOCKED).build())) {
            if (!blocked.getDependencies().isEmpty()) {
                blockedOn.put(blocked.getId(), blocked.getDependencies());
            }
        }

        boolean deleted = store.delete(taskId);
        if (deleted) {
            log.info("Task deleted taskId={}", taskId);
            // the cascade strips edges to deleted tasks, which may leave a dependent with nothing to wait on
            blockedOn.forEach((id, before) -> store.get(id)
                    .filter(t -> !t.getDependencies().equals(before))
                    .ifPresent(lifecycle::releaseIfReady));
        }
        return deleted;
    }

    @Override
    public boolean addDependency(String taskId, String dependsOnId) {
        return update(taskId, TaskPatch.builder().addDependency(dependsOnId).build());
    }

    @Override
    public boolean removeDependency(String taskId, String dependsOnId) {
        return update(taskId, TaskPatch.builder().removeDependency(dependsOnId).build());
    }

    @Override
    public ValidationResult validateDependencies(String taskId) {
        return validator.validate(taskId);
    }

    @Override
    public Optional<Readiness> readiness(String taskId) {
        return validator.isReady(taskId);
    }

    @Override
    public boolean complete(String taskId) {
        return lifecycle.complete(taskId);
    }

    @Override
    public List<Task> prioritized() {
        Comparator<Task> order = Comparator.comparingDouble(Task::getDynamicPriorityScore).reversed()
                .thenComparing(Task::getDueDate, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(Task::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()));
        return store.list(TaskFilter.builder().excludeTerminal().build()).stream()
                .sorted(order)
                .toList();
    }

    @Override
    public TaskStats stats() {
        return TaskStats.of(store.list(), clock);
    }

    @Override
    public List<Interaction> recentInteractions(int limit) {
        return interactions.recent(limit);
    }

    @Override
    public Map<String, HandlerState> handlerStates() {
        return registry.states();
    }

    @Override
    public Map<String, Integer> runMaintenance() {
        Map<String, Integer> written = new LinkedHashMap<>();
        for (MaintenancePass pass : passes) {
            written.put(pass.name(), pass.run());
        }
        log.info("Maintenance run finished written={}", written);
        return written;
    }

    @Override
    public void backup(Path path) {
        store.backup(path);
    }

    @Override
    public void restore(Path path) {
        store.restore(path);
    }

    /* ================= dispatch ================= */

    @Override
    public void submit(WorkItem item) {
        Objects.requireNonNull(item, "item must not be null");
        queue.enqueue(item);
        log.debug("Work item queued taskId={} handler={} queued={}", item.taskId(), item.assignedHandler(), queue.size());
    }

    @Override
    public void submit(String query) {
        submit(WorkItem.of(query));
    }

    @Override
    public boolean dispatchTask(String taskId) {
        Optional<Task> task = store.get(taskId);
        if (task.isEmpty()) {
            return false;
        }
        Task t = task.get();
        submit(new WorkItem(t.getId(), t.getTitle(), t.getAssignedHandler()));
        return true;
    }

    @Override
    public Task enqueueComplexGoal(String goal) {
        if (goal == null || goal.isBlank()) {
            throw new TaskValidationException("goal must not be blank");
        }

        List<SubtaskDraft> drafts = List.of();
        try {
            List<SubtaskDraft> proposed = decomposer.decompose(goal);
            if (proposed != null) {
                drafts = proposed.stream()
                        .filter(d -> d != null && d.isUsable())
                        .limit(MAX_SUBTASKS)
                        .toList();
            }
        } catch (Exception e) {
            log.warn("Goal decomposition failed, using fallback plan goal={} msg={}", goal, e.getMessage());
        }
        if (drafts.isEmpty()) {
            drafts = fallbackDrafts(goal);
        }

        Task draft = new Task(goal);
        draft.setDescription("Complex goal decomposed into " + drafts.size() + " subtasks");
        Task parent = store.create(draft);
        store.update(parent.getId(), TaskPatch.status(TaskStatus.IN_PROGRESS));

        for (SubtaskDraft d : drafts) {
            Task child = new Task(d.title().trim());
            child.setDescription(d.description() == null ? "" : d.description());
            child.setParentId(parent.getId());
            store.create(child);
        }
        log.info("Complex goal planned taskId={} subtasks={}", parent.getId(), drafts.size());
        return store.getRequired(parent.getId());
    }

    static List<SubtaskDraft> fallbackDrafts(String goal) {
        return List.of(
                new SubtaskDraft("Research: " + goal, "Gather information and requirements"),
                new SubtaskDraft("Plan: " + goal, "Break the work into concrete steps"),
                new SubtaskDraft("Execute: " + goal, "Carry out the plan")
        );
    }

    private void dispatchLoop() {
        while (started.get()) {
            WorkItem item;
            try {
                item = queue.dequeue();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            try {
                dispatch(item);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("buddy dispatch failed taskId={} msg={}", item.taskId(), e.getMessage(), e);
            } finally {
                MdcContext.clear();
            }
        }
        log.debug("Dispatcher loop exited");
    }

    private void dispatch(WorkItem item) throws InterruptedException {
        String handlerName = resolveHandler(item);
        MdcContext.setDispatch(item, handlerName);

        String taskId = item.taskId();
        if (taskId == null) {
            if (acquireOrGiveUp(handlerName, null, null)) {
                submitInvocation(handlerName, new HandlerRequest(item, null,
                        interactions.recent(props.getHistoryContextSize())), null);
            }
            return;
        }

        Optional<Task> loaded = store.get(taskId);
        if (loaded.isEmpty()) {
            log.warn("Dropping work item for unknown task taskId={}", taskId);
            return;
        }
        Task task = loaded.get();
        if (task.getStatus().isTerminal()) {
            log.warn("Dropping work item for {} task taskId={}", task.getStatus().label(), taskId);
            return;
        }
        if (!dispatching.add(taskId)) {
            log.warn("Dropping work item, task is already being dispatched taskId={}", taskId);
            return;
        }

        boolean handedOff = false;
        try {
            Readiness readiness = lifecycle.blockIfNotReady(task);
            if (!readiness.ready()) {
                log.warn("Dropping work item, dependencies not ready taskId={} blocking={}", taskId, readiness.blocking());
                return;
            }
            TaskStatus prior = task.getStatus();
            lifecycle.markInProgress(taskId);

            if (!acquireOrGiveUp(handlerName, taskId, prior)) {
                return;
            }
            Task snapshot = store.get(taskId).orElse(null);
            HandlerRequest request = new HandlerRequest(item, snapshot, interactions.recent(props.getHistoryContextSize()));
            handedOff = submitInvocation(handlerName, request, prior);
        } finally {
            if (!handedOff) {
                dispatching.remove(taskId);
            }
        }
    }

    /**
     * Acquires the handler within the retry budget. On exhaustion the task is blocked; on interrupt it is
     * restored and the interrupt rethrown.
     */
    private boolean acquireOrGiveUp(String handlerName, String taskId, TaskStatus prior) throws InterruptedException {
        boolean acquired;
        try {
            acquired = acquire(handlerName);
        } catch (InterruptedException e) {
            if (taskId != null) {
                lifecycle.restore(taskId, prior, null);
            }
            log.info("Dispatch interrupted while waiting for handler={}", handlerName);
            throw e;
        }

        if (!acquired) {
            log.warn("Handler stayed busy, abandoning work item handler={} attempts={} taskId={}",
                    handlerName, props.getAcquireAttempts(), taskId);
            if (taskId != null) {
                lifecycle.block(taskId, "Handler '" + handlerName + "' stayed busy after "
                        + props.getAcquireAttempts() + " attempts; re-submit the task to retry");
            }
        }
        return acquired;
    }

    private boolean acquire(String handlerName) throws InterruptedException {
        int attempts = props.getAcquireAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (registry.tryAcquire(handlerName)) {
                return true;
            }
            log.debug("Handler busy handler={} attempt={}/{}", handlerName, attempt, attempts);
            if (attempt < attempts) {
                Thread.sleep(props.getAcquireBackoff().toMillis());
            }
        }
        return false;
    }

    private boolean submitInvocation(String handlerName, HandlerRequest request, TaskStatus prior) {
        try {
            workerPool.submit(() -> invoke(handlerName, request, prior));
            return true;
        } catch (RejectedExecutionException e) {
            registry.release(handlerName);
            if (request.item().taskId() != null) {
                lifecycle.restore(request.item().taskId(), prior, null);
            }
            log.warn("Worker pool rejected work item handler={}", handlerName);
            return false;
        }
    }

    private void invoke(String handlerName, HandlerRequest request, TaskStatus prior) {
        String taskId = request.item().taskId();
        MdcContext.setDispatch(request.item(), handlerName);
        CallTimer timer = new CallTimer(handlerName);
        try {
            HandlerResult result;
            try {
                TaskHandler handler = registry.getRequired(handlerName);
                result = handler.handle(request);
                if (result == null) {
                    result = HandlerResult.failed("Handler '" + handlerName + "' returned no result");
                }
            } catch (Exception e) {
                log.error("Handler failed handler={} taskId={} msg={}", handlerName, taskId, e.getMessage(), e);
                result = HandlerResult.failed("Handler '" + handlerName + "' failed: " + e.getMessage());
            }
            if (timer.finish()) {
                result = HandlerResult.failed("Handler '" + handlerName + "' timed out after " + props.getHandlerTimeout());
            }
            recordOutcome(handlerName, request, prior, result);
        } finally {
            timer.finish();
            registry.release(handlerName);
            if (taskId != null) {
                dispatching.remove(taskId);
            }
            log.debug("Handler released handler={}", handlerName);
            MdcContext.clear();
        }
    }

    /**
     * Interrupts the worker thread once the handler timeout elapses. The clock starts when the call
     * starts, not when it is queued.
     */
    private final class CallTimer {
        private final Thread worker = Thread.currentThread();
        private final ScheduledFuture<?> alarm;
        private boolean finished;
        private boolean fired;

        CallTimer(String handlerName) {
            Duration timeout = props.getHandlerTimeout();
            ScheduledExecutorService timers = watchdog;
            if (timeout == null || timers == null) {
                alarm = null;
                return;
            }
            ScheduledFuture<?> scheduled;
            try {
                scheduled = timers.schedule(() -> fire(handlerName, timeout), timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("Watchdog is shut down, running without timeout handler={}", handlerName);
                scheduled = null;
            }
            alarm = scheduled;
        }

        private synchronized void fire(String handlerName, Duration timeout) {
            if (!finished) {
                fired = true;
                log.warn("Handler exceeded timeout handler={} timeout={}", handlerName, timeout);
                worker.interrupt();
            }
        }

        /**
         * Stops the alarm; no interrupt is delivered after this returns.
         *
         * @return whether the timeout fired
         */
        synchronized boolean finish() {
            if (!finished) {
                finished = true;
                if (alarm != null) {
                    alarm.cancel(false);
                }
                if (fired) {
                    // clear the timeout interrupt before touching the store
                    Thread.interrupted();
                }
            }
            return fired;
        }
    }

    private void recordOutcome(String handlerName, HandlerRequest request, TaskStatus prior, HandlerResult result) {
        String taskId = request.item().taskId();
        try {
            if (taskId != null) {
                if (result.success()) {
                    lifecycle.completeDispatched(taskId);
                } else {
                    lifecycle.restore(taskId, prior, result.text());
                }
            }
        } catch (Exception e) {
            log.error("Failed to record handler outcome handler={} taskId={} msg={}", handlerName, taskId, e.getMessage(), e);
        }
        interactions.record(new Interaction(
                request.query(),
                handlerName,
                result.text(),
                taskId,
                result.success(),
                Instant.now(clock)
        ));
        log.info("Handler finished handler={} taskId={} success={}", handlerName, taskId, result.success());
    }

    private String resolveHandler(WorkItem item) {
        String requested = item.assignedHandler();
        if (requested != null) {
            if (registry.contains(requested)) {
                return requested;
            }
            log.warn("Assigned handler is not registered, using default handler={} default={}", requested, props.getDefaultHandler());
            return props.getDefaultHandler();
        }

        String classified;
        try {
            classified = classifier.classify(item.query());
        } catch (Exception e) {
            log.warn("Intent classification failed, using default handler={} msg={}", props.getDefaultHandler(), e.getMessage());
            return props.getDefaultHandler();
        }
        if (classified == null || !registry.contains(classified.trim())) {
            log.warn("Classifier returned unknown handler={}, using default={}", classified, props.getDefaultHandler());
            return props.getDefaultHandler();
        }
        return classified.trim();
    }
}
