package com.questrail.consensus.engine;

import com.questrail.consensus.model.Block;
import com.questrail.consensus.model.BlockId;
import com.questrail.consensus.model.Slot;
import com.questrail.consensus.model.Wrapped;

import java.util.List;
import java.util.Objects;

/**
 * An active block as exported from, or bootstrapped into, a block graph.
 *
 * @param parents one entry per thread: the parent's id and period
 */
public record ExportActiveBlock(Wrapped<Block, BlockId> block,
                                List<ParentRef> parents,
                                boolean isFinal) {

    /** Parent reference carrying the parent's period. */
    public record ParentRef(BlockId id, long period) {
        public ParentRef {
            Objects.requireNonNull(id, "id");
        }
    }

    public ExportActiveBlock {
        Objects.requireNonNull(block, "block");
        parents = List.copyOf(parents);
    }

    public BlockId blockId() {
        return block.id();
    }

    public Slot slot() {
        return block.content().slot();
    }
}
