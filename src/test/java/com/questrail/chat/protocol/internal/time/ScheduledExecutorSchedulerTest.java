package com.questrail.chat.protocol.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * The production scheduler against real time. Waits are generous; only
 * ordering and cancellation are asserted, never exact latency.
 */
class ScheduledExecutorSchedulerTest {

    private ScheduledThreadPoolExecutor executor;
    private ScheduledExecutorScheduler scheduler;
    private final MonotonicClock clock = SystemMonotonicClock.INSTANCE;

    @BeforeEach
    void setUp() {
        executor = new ScheduledThreadPoolExecutor(1);
        executor.setRemoveOnCancelPolicy(true);
        scheduler = new ScheduledExecutorScheduler(executor, clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void delayedTaskRuns() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.scheduleAfter(Duration.ofMillis(20), clock, latch::countDown);

        assertTrue(latch.await(2, TimeUnit.SECONDS));
    }

    @Test
    void pastDeadlineRunsWithoutDelay() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.scheduleAtNanos(clock.nowNanos() - TimeUnit.SECONDS.toNanos(1), latch::countDown);

        assertTrue(latch.await(2, TimeUnit.SECONDS));
    }

    @Test
    void cancelledTaskNeverRuns() throws InterruptedException {
        AtomicBoolean ran = new AtomicBoolean(false);

        Cancellable handle = scheduler.scheduleAfter(Duration.ofMillis(100), clock, () -> ran.set(true));

        assertTrue(handle.cancel());
        assertEquals(0, executor.getQueue().size());
        Thread.sleep(200);
        assertFalse(ran.get());
    }

    @Test
    void cancelAfterRunReportsFalse() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        Cancellable handle = scheduler.scheduleAtNanos(clock.nowNanos(), latch::countDown);

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        Thread.sleep(20);
        assertFalse(handle.cancel());
    }

    @Test
    void tasksRunInDeadlineOrder() throws InterruptedException {
        List<String> order = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(3);
        long now = clock.nowNanos();

        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(60), () -> { order.add("flush"); latch.countDown(); });
        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(40), () -> { order.add("retransmit"); latch.countDown(); });
        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(20), () -> { order.add("confirm"); latch.countDown(); });

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertEquals(List.of("confirm", "retransmit", "flush"), order);
    }

    @Test
    void schedulingAfterShutdownIsDiscarded() {
        executor.shutdown();

        Cancellable handle = scheduler.scheduleAfter(Duration.ofMillis(10), clock, () -> fail("must not run"));

        assertFalse(handle.cancel());
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleAfter(Duration.ofMillis(-1), clock, () -> { }));
    }
}
