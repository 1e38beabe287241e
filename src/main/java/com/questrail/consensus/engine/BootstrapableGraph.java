package com.questrail.consensus.engine;

import com.questrail.consensus.model.BlockId;

import java.util.List;
import java.util.Map;

/**
 * Block graph state an engine can be started from.
 *
 * @param activeBlocks active blocks keyed by id
 * @param bestParents  best parent per thread, indexed by thread
 */
public record BootstrapableGraph(Map<BlockId, ExportActiveBlock> activeBlocks,
                                 List<BlockId> bestParents) {
    public BootstrapableGraph {
        activeBlocks = Map.copyOf(activeBlocks);
        bestParents = List.copyOf(bestParents);
    }

    public static BootstrapableGraph empty() {
        return new BootstrapableGraph(Map.of(), List.of());
    }

    public boolean isEmpty() {
        return activeBlocks.isEmpty();
    }
}
