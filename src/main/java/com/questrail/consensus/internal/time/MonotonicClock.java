package com.questrail.consensus.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every deadline computed by the harness and the worker.
 *
 * <h2>Binding invariant</h2>
 * Command wait deadlines, drain poll intervals and slot ticks MUST use a
 * monotonic time source. Wall-clock time ({@code Instant.now()}) is permitted
 * only for observability timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
