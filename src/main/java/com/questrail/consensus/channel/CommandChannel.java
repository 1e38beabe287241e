package com.questrail.consensus.channel;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * CommandChannel
 * -----------------------------------------------------------------------------
 * Bounded FIFO conduit with a blocking send side and a receive-with-timeout side.
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>Messages are received in exactly the order they were sent.</li>
 *   <li>{@link #receive(Duration)} returns empty only after the full timeout
 *       elapsed.</li>
 *   <li>{@link #close()} wakes every blocked sender and receiver; senders then
 *       fail with {@link ChannelClosedException}. Messages already queued
 *       remain receivable.</li>
 * </ul>
 *
 * @param <T> message type
 */
public final class CommandChannel<T> implements CommandSender<T>, TimedReceiver<T>
{
    private final String name;
    private final int capacity;
    private final ArrayDeque<T> queue;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    private boolean closed;

    public CommandChannel(String name, int capacity)
    {
        this.name = Objects.requireNonNull(name, "name");
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public String name() {
        return name;
    }

    public int capacity() {
        return capacity;
    }

    @Override
    public void send(T message)
    {
        Objects.requireNonNull(message, "message");
        lock.lock();
        try {
            while (!closed && queue.size() >= capacity) {
                notFull.awaitUninterruptibly();
            }
            if (closed) {
                throw new ChannelClosedException(name);
            }
            queue.addLast(message);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean trySend(T message)
    {
        Objects.requireNonNull(message, "message");
        lock.lock();
        try {
            if (closed) {
                throw new ChannelClosedException(name);
            }
            if (queue.size() >= capacity) {
                return false;
            }
            queue.addLast(message);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<T> receive(Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        long remaining = Math.max(0, timeout.toNanos());
        lock.lock();
        try {
            while (queue.isEmpty()) {
                if (closed) {
                    throw new ChannelClosedException(name);
                }
                if (remaining <= 0) {
                    return Optional.empty();
                }
                try {
                    remaining = notEmpty.awaitNanos(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return Optional.empty();
                }
            }
            return Optional.of(dequeue());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<T> tryReceive()
    {
        lock.lock();
        try {
            if (queue.isEmpty()) {
                if (closed) {
                    throw new ChannelClosedException(name);
                }
                return Optional.empty();
            }
            return Optional.of(dequeue());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the channel. Idempotent.
     */
    public void close()
    {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed()
    {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of queued messages, for diagnostics.
     */
    public int size()
    {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    private T dequeue()
    {
        T message = queue.pollFirst();
        notFull.signal();
        return message;
    }

    @Override
    public String toString() {
        return "CommandChannel[" + name + ", capacity=" + capacity + "]";
    }
}
