package com.questrail.consensus.internal.worker;

import com.questrail.consensus.internal.time.Cancellable;
import com.questrail.consensus.internal.time.MonotonicClock;
import com.questrail.consensus.internal.time.MonotonicScheduler;
import com.questrail.consensus.model.Slot;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * SlotTicker
 * -----------------------------------------------------------------------------
 * Advances the worker's slot once per slot duration.
 *
 * <p>Deadlines are computed from the start instant, so late callbacks do not
 * accumulate drift. The n-th tick reports the n-th slot after the start slot.
 * Each tick schedules the next one; {@link #cancel()} stops the chain.</p>
 */
final class SlotTicker
{
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final long slotNanos;
    private final int threadCount;
    private final Consumer<Slot> onTick;

    private final Object lock = new Object();
    private Slot current;
    private long startNanos;
    private long ticks;
    private Cancellable pending;
    private boolean cancelled;

    SlotTicker(MonotonicScheduler scheduler,
               MonotonicClock clock,
               Duration slotDuration,
               int threadCount,
               Slot startSlot,
               Consumer<Slot> onTick) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.slotNanos = Objects.requireNonNull(slotDuration, "slotDuration").toNanos();
        this.threadCount = threadCount;
        this.current = Objects.requireNonNull(startSlot, "startSlot");
        this.onTick = Objects.requireNonNull(onTick, "onTick");
        if (slotNanos <= 0) {
            throw new IllegalArgumentException("slotDuration must be positive");
        }
    }

    void start() {
        synchronized (lock) {
            startNanos = clock.nowNanos();
            scheduleNextLocked();
        }
    }

    /**
     * Stops ticking. A tick already running completes, but schedules nothing.
     */
    void cancel() {
        synchronized (lock) {
            cancelled = true;
            if (pending != null) {
                pending.cancel();
                pending = null;
            }
        }
    }

    Slot currentSlot() {
        synchronized (lock) {
            return current;
        }
    }

    private void scheduleNextLocked() {
        if (cancelled) {
            return;
        }
        long deadline = startNanos + (ticks + 1) * slotNanos;
        pending = scheduler.scheduleAtNanos(deadline, this::fire);
    }

    private void fire() {
        Slot slot;
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            ticks++;
            current = current.next(threadCount);
            slot = current;
        }
        onTick.accept(slot);
        synchronized (lock) {
            scheduleNextLocked();
        }
    }
}
