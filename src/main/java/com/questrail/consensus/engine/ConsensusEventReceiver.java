package com.questrail.consensus.engine;

import com.questrail.consensus.channel.ChannelClosedException;
import com.questrail.consensus.channel.TimedReceiver;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Receive side of the engine's event channel.
 */
public final class ConsensusEventReceiver implements TimedReceiver<ConsensusEvent>
{
    private final TimedReceiver<ConsensusEvent> receiver;

    public ConsensusEventReceiver(TimedReceiver<ConsensusEvent> receiver) {
        this.receiver = Objects.requireNonNull(receiver, "receiver");
    }

    @Override
    public Optional<ConsensusEvent> receive(Duration timeout) {
        return receiver.receive(timeout);
    }

    @Override
    public Optional<ConsensusEvent> tryReceive() {
        return receiver.tryReceive();
    }

    /**
     * Discards every queued event.
     *
     * @return the number of events discarded
     */
    public int drain() {
        int drained = 0;
        try {
            while (receiver.tryReceive().isPresent()) {
                drained++;
            }
        } catch (ChannelClosedException e) {
            // Closed and empty: nothing left to drain.
            return drained;
        }
        return drained;
    }
}
