package com.questrail.consensus.engine.pool;

import com.questrail.consensus.model.Slot;

import java.util.List;
import java.util.Objects;

/**
 * Everything the engine emits toward the transaction-pool collaborator.
 */
public sealed interface PoolCommand
        permits PoolCommand.UpdateCurrentSlot, PoolCommand.UpdateLatestFinalPeriods
{
    /** The current time slot advanced. */
    record UpdateCurrentSlot(Slot slot) implements PoolCommand {
        public UpdateCurrentSlot {
            Objects.requireNonNull(slot, "slot");
        }
    }

    /** Latest final period, indexed by thread. */
    record UpdateLatestFinalPeriods(List<Long> periods) implements PoolCommand {
        public UpdateLatestFinalPeriods {
            periods = List.copyOf(periods);
        }
    }
}
