package com.questrail.chat.protocol.internal.time;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <p>Monotonic deadlines are converted to relative delays at scheduling time,
 * using the same {@link MonotonicClock} callers use to compute them.</p>
 *
 * <p>The executor is owned by the caller. Once it has been shut down, newly
 * scheduled tasks are discarded and the returned handle reports nothing to
 * cancel.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private static final Cancellable NOT_SCHEDULED = () -> false;

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // Past deadlines run immediately.
        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());

        if (executor.isShutdown()) {
            return NOT_SCHEDULED;
        }
        try {
            ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
            return () -> future.cancel(false);
        } catch (RejectedExecutionException e) {
            // Lost the race with shutdown.
            return NOT_SCHEDULED;
        }
    }
}
