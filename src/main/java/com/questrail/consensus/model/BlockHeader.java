package com.questrail.consensus.model;

import java.util.List;
import java.util.Objects;

/**
 * Block header: slot, one parent per thread, the operation merkle root and
 * the endorsements carried by the block.
 */
public record BlockHeader(Slot slot,
                          List<BlockId> parents,
                          Hash operationMerkleRoot,
                          List<Wrapped<Endorsement, EndorsementId>> endorsements) {
    public BlockHeader {
        Objects.requireNonNull(slot, "slot");
        Objects.requireNonNull(operationMerkleRoot, "operationMerkleRoot");
        parents = List.copyOf(parents);
        endorsements = List.copyOf(endorsements);
    }
}
