package com.questrail.consensus.engine;

import com.questrail.consensus.model.BlockId;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of an engine's block graph, answered to
 * {@link ConsensusCommandSender#getBlockGraphStatus()}.
 *
 * @param genesisBlocks           genesis block per thread
 * @param activeBlocks            active blocks keyed by id
 * @param bestParents             best parent per thread
 * @param latestFinalBlockPeriods latest final period per thread
 * @param maxCliques              maximal cliques
 */
public record BlockGraphExport(List<BlockId> genesisBlocks,
                               Map<BlockId, ExportActiveBlock> activeBlocks,
                               List<BlockId> bestParents,
                               List<Long> latestFinalBlockPeriods,
                               List<Clique> maxCliques) {
    public BlockGraphExport {
        genesisBlocks = List.copyOf(genesisBlocks);
        activeBlocks = Map.copyOf(activeBlocks);
        bestParents = List.copyOf(bestParents);
        latestFinalBlockPeriods = List.copyOf(latestFinalBlockPeriods);
        maxCliques = List.copyOf(maxCliques);
    }

    /**
     * Re-exports this graph as bootstrap state.
     */
    public BootstrapableGraph toBootstrapableGraph() {
        return new BootstrapableGraph(activeBlocks, bestParents);
    }
}
