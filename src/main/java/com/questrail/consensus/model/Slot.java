package com.questrail.consensus.model;

/**
 * Time slot: a period index and the thread within that period.
 * Slots order by period, then thread.
 */
public record Slot(long period, int thread) implements Comparable<Slot> {

    public Slot {
        if (period < 0) {
            throw new IllegalArgumentException("period must be >= 0");
        }
        if (thread < 0) {
            throw new IllegalArgumentException("thread must be >= 0");
        }
    }

    public static Slot of(long period, int thread) {
        return new Slot(period, thread);
    }

    /**
     * The slot that follows this one when there are {@code threadCount} threads.
     */
    public Slot next(int threadCount) {
        if (thread + 1 >= threadCount) {
            return new Slot(period + 1, 0);
        }
        return new Slot(period, thread + 1);
    }

    @Override
    public int compareTo(Slot o) {
        int byPeriod = Long.compare(period, o.period);
        return byPeriod != 0 ? byPeriod : Integer.compare(thread, o.thread);
    }

    @Override
    public String toString() {
        return "(" + period + "," + thread + ")";
    }
}
