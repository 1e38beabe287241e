package com.questrail.consensus.channel;

import java.time.Duration;
import java.util.Optional;

/**
 * Receive side of a {@link CommandChannel}.
 *
 * @param <T> message type
 */
public interface TimedReceiver<T>
{
    /**
     * Removes and returns the next message, waiting up to {@code timeout}.
     *
     * <p>An empty result means the full timeout elapsed without a message, or
     * the calling thread was interrupted (its interrupt flag is then set).</p>
     *
     * @throws ChannelClosedException if the channel is closed and drained
     */
    Optional<T> receive(Duration timeout);

    /**
     * Removes and returns the next message if one is already queued.
     *
     * @throws ChannelClosedException if the channel is closed and drained
     */
    Optional<T> tryReceive();
}
