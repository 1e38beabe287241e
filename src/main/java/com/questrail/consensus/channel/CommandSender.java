package com.questrail.consensus.channel;

/**
 * Send side of a {@link CommandChannel}.
 *
 * @param <T> message type
 */
public interface CommandSender<T>
{
    /**
     * Enqueue a message, blocking while the channel is full.
     *
     * @throws ChannelClosedException if the channel is, or becomes, closed
     */
    void send(T message);

    /**
     * Enqueue a message only if there is room right now.
     *
     * @return {@code false} if the channel was full
     * @throws ChannelClosedException if the channel is closed
     */
    boolean trySend(T message);
}
