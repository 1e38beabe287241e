package com.questrail.consensus.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Scheduler surface used by the worker's slot ticker.
 *
 * <h2>Binding invariant</h2>
 * Scheduling is expressed in monotonic ticks or durations, never in
 * wall-clock instants.
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline in nanoseconds (from {@link MonotonicClock#nowNanos()})
     * @param task          runnable task
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule after a duration, measured on the given clock.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long deadline = clock.nowNanos() + delay.toNanos();
        return scheduleAtNanos(deadline, task);
    }
}
