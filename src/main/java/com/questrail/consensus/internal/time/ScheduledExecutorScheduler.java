package com.questrail.consensus.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <p>Deadlines are converted into relative delays using the supplied clock at
 * scheduling time, so the same clock must be used by callers computing
 * deadlines. The executor is not owned here; callers shut it down.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // Deadlines in the past run immediately.
        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }
}
