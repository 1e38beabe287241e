package com.questrail.consensus.engine.protocol;

import com.questrail.consensus.model.Block;
import com.questrail.consensus.model.BlockId;
import com.questrail.consensus.model.EndorsementId;
import com.questrail.consensus.model.OperationId;
import com.questrail.consensus.model.Wrapped;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ProtocolCommand
 * -----------------------------------------------------------------------------
 * Everything the engine emits toward the network-protocol collaborator.
 *
 * <p>Commands are immutable once emitted. Tests observe them through
 * {@code MockProtocolController#waitCommand} and pattern-match on the
 * concrete record type.</p>
 */
public sealed interface ProtocolCommand
        permits ProtocolCommand.IntegratedBlock, ProtocolCommand.WishlistDelta,
                ProtocolCommand.AttackBlockDetected, ProtocolCommand.GetBlocksResults
{
    /** A block became fully integrated and may be propagated. */
    record IntegratedBlock(BlockId blockId,
                           Set<OperationId> operationIds,
                           List<EndorsementId> endorsementIds) implements ProtocolCommand {
        public IntegratedBlock {
            Objects.requireNonNull(blockId, "blockId");
            operationIds = Set.copyOf(operationIds);
            endorsementIds = List.copyOf(endorsementIds);
        }
    }

    /**
     * The set of wanted blocks changed.
     *
     * @param newBlocks blocks newly wanted
     * @param remove    blocks no longer wanted
     */
    record WishlistDelta(Set<BlockId> newBlocks, Set<BlockId> remove) implements ProtocolCommand {
        public WishlistDelta {
            newBlocks = Set.copyOf(newBlocks);
            remove = Set.copyOf(remove);
        }
    }

    /** A node attempted to produce two different blocks for one slot. */
    record AttackBlockDetected(BlockId blockId) implements ProtocolCommand {
        public AttackBlockDetected {
            Objects.requireNonNull(blockId, "blockId");
        }
    }

    /**
     * Answer to a batch of block lookups; a requested id maps to an empty
     * optional when the block is unknown.
     */
    record GetBlocksResults(Map<BlockId, Optional<Wrapped<Block, BlockId>>> results) implements ProtocolCommand {
        public GetBlocksResults {
            results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        }
    }
}
