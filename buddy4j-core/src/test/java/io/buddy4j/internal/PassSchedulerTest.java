package io.buddy4j.internal;

import io.buddy4j.maintenance.MaintenancePass;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PassSchedulerTest {

    @Test
    void failingPassKeepsItsScheduleAndStopCancelsTimers() throws InterruptedException {
        CountingPass healthy = new CountingPass("healthy", false);
        CountingPass failing = new CountingPass("failing", true);
        PassScheduler scheduler = new PassScheduler(List.of(
                new PassScheduler.ScheduledPass(healthy, "1s"),
                new PassScheduler.ScheduledPass(failing, "1s")
        ), ZoneOffset.UTC, Clock.systemUTC());

        scheduler.start();
        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> failing.runs.get() >= 2 && healthy.runs.get() >= 2));
        scheduler.stop(Duration.ofSeconds(5));

        int afterStop = healthy.runs.get();
        Thread.sleep(1500);
        assertEquals(afterStop, healthy.runs.get());
    }

    @Test
    void invalidSpecIsRejectedUpFront() {
        assertThrows(IllegalArgumentException.class,
                () -> new PassScheduler.ScheduledPass(new CountingPass("x", false), "every so often"));
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(50);
        }
        return false;
    }

    private static final class CountingPass implements MaintenancePass {
        private final String name;
        private final boolean fail;
        private final AtomicInteger runs = new AtomicInteger();

        private CountingPass(String name, boolean fail) {
            this.name = name;
            this.fail = fail;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public int run() {
            runs.incrementAndGet();
            if (fail) {
                throw new IllegalStateException("store offline");
            }
            return 0;
        }
    }
}
