package com.questrail.consensus.observability;

import com.questrail.consensus.model.BlockId;
import com.questrail.consensus.model.Slot;

import java.time.Instant;

/**
 * A block joined the active graph.
 */
public record BlockIntegratedEvent(
    Instant timestamp,
    BlockId blockId,
    Slot slot,
    boolean fromWaitingList
) {
}
