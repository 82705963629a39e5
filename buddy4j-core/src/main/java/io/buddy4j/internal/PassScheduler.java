package io.buddy4j.internal;

import io.buddy4j.logging.MdcContext;
import io.buddy4j.maintenance.MaintenancePass;
import io.buddy4j.utils.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs each maintenance pass on its own timer. After every run the pass is rescheduled from its schedule,
 * so a slow pass never overlaps with itself.
 */
class PassScheduler {

    private static final Logger log = LoggerFactory.getLogger(PassScheduler.class);

    record ScheduledPass(MaintenancePass pass, String spec) {
        ScheduledPass {
            Objects.requireNonNull(pass, "pass must not be null");
            IntervalParser.validate(spec);
        }
    }

    private final List<ScheduledPass> passes;
    private final ZoneId zone;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Map<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();
    private ScheduledExecutorService executor;

    PassScheduler(List<ScheduledPass> passes, ZoneId zone, Clock clock) {
        this.passes = List.copyOf(passes);
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        executor = Executors.newScheduledThreadPool(Math.max(1, passes.size()), r -> {
            Thread t = new Thread(r);
            t.setName("buddy.maintenance");
            t.setDaemon(true);
            return t;
        });
        for (ScheduledPass scheduled : passes) {
            scheduleNext(scheduled);
            log.info("Scheduled maintenance pass name={} every={}", scheduled.pass().name(), scheduled.spec());
        }
    }

    void stop(Duration timeout) {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        timers.values().forEach(f -> f.cancel(false));
        timers.clear();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.error("Maintenance passes did not finish within {}; interrupting", timeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        } finally {
            executor = null;
        }
    }

    private void scheduleNext(ScheduledPass scheduled) {
        if (!running.get()) {
            return;
        }
        Instant now = clock.instant();
        Instant next = IntervalParser.nextRun(scheduled.spec(), zone, now);
        long delayMs = Math.max(0, Duration.between(now, next).toMillis());
        try {
            timers.put(scheduled.pass().name(),
                    executor.schedule(() -> runAndReschedule(scheduled), delayMs, TimeUnit.MILLISECONDS));
        } catch (RuntimeException e) {
            if (running.get()) {
                log.error("Failed to schedule maintenance pass name={} msg={}", scheduled.pass().name(), e.getMessage(), e);
            }
        }
    }

    private void runAndReschedule(ScheduledPass scheduled) {
        MaintenancePass pass = scheduled.pass();
        MdcContext.setPass(pass.name());
        try {
            int written = pass.run();
            log.debug("Maintenance pass finished name={} written={}", pass.name(), written);
        } catch (Exception e) {
            log.error("Maintenance pass failed name={} msg={}", pass.name(), e.getMessage(), e);
        } finally {
            MdcContext.clear();
            scheduleNext(scheduled);
        }
    }
}
