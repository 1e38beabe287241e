package com.questrail.consensus.channel;

/**
 * Raised when a channel endpoint is used after the channel was closed.
 *
 * <p>Always a transport failure: the peer on the other side is gone and no
 * valid exchange can continue.</p>
 */
public final class ChannelClosedException extends RuntimeException
{
    public ChannelClosedException(String channelName) {
        super("channel '" + channelName + "' is closed");
    }
}
