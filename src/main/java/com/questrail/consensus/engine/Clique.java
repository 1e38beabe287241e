package com.questrail.consensus.engine;

import com.questrail.consensus.model.BlockId;

import java.util.Set;

/**
 * A maximal set of mutually compatible blocks.
 */
public record Clique(Set<BlockId> blockIds, boolean isBlockclique) {
    public Clique {
        blockIds = Set.copyOf(blockIds);
    }
}
