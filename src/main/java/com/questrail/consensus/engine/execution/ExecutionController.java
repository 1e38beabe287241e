package com.questrail.consensus.engine.execution;

import com.questrail.consensus.model.BlockId;
import com.questrail.consensus.model.Slot;

import java.util.Map;

/**
 * Engine-facing port of the execution collaborator.
 *
 * <p>Implementations may block (for example on a full channel); callers must
 * not hold locks while calling.</p>
 */
public interface ExecutionController
{
    /**
     * Reports newly finalized blocks and the current blockclique.
     */
    void updateBlockcliqueStatus(Map<Slot, BlockId> finalizedBlocks, Map<Slot, BlockId> blockclique);
}
