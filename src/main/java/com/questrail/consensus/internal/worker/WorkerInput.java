package com.questrail.consensus.internal.worker;

import com.questrail.consensus.engine.protocol.ProtocolEvent;
import com.questrail.consensus.model.Slot;

import java.util.Objects;

/**
 * WorkerInput
 * -----------------------------------------------------------------------------
 * Everything that can advance the worker's block graph. Inputs are applied one
 * at a time by {@link BlockGraphReducer}; they are immutable and carry only
 * what the reducer needs.
 */
sealed interface WorkerInput permits WorkerInput.Inbound, WorkerInput.SlotTick
{
    /** A stimulus received from the protocol collaborator. */
    record Inbound(ProtocolEvent event) implements WorkerInput {
        public Inbound {
            Objects.requireNonNull(event, "event");
        }
    }

    /** The worker's clock reached a new slot. */
    record SlotTick(Slot slot) implements WorkerInput {
        public SlotTick {
            Objects.requireNonNull(slot, "slot");
        }
    }
}
