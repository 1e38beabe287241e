package com.questrail.consensus.model;

import java.util.Objects;

/**
 * Endorsement of a block by the staker drawn for {@code index} at {@code slot}.
 */
public record Endorsement(Slot slot, int index, BlockId endorsedBlock) {
    public Endorsement {
        Objects.requireNonNull(slot, "slot");
        Objects.requireNonNull(endorsedBlock, "endorsedBlock");
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
    }
}
