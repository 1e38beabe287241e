package com.questrail.consensus.observability;

import com.questrail.consensus.model.BlockId;

import java.time.Instant;

/**
 * A received block was dropped without being integrated.
 */
public record BlockDiscardedEvent(
    Instant timestamp,
    BlockId blockId,
    Reason reason
) {
    public enum Reason {
        INVALID_SIGNATURE,
        INVALID_SLOT,
        WRONG_PARENT_COUNT,
        INCOMPATIBLE_PARENTS,
        TOO_FAR_IN_FUTURE,
        MULTISTAKING
    }
}
