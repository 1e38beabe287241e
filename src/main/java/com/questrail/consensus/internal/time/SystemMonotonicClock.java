package com.questrail.consensus.internal.time;

/**
 * Production {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <p>Not affected by wall-clock adjustments. For deterministic tests use
 * {@code ManualMonotonicClock} instead.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
