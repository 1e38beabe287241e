package com.questrail.consensus.engine.protocol;

import com.questrail.consensus.model.Block;
import com.questrail.consensus.model.BlockHeader;
import com.questrail.consensus.model.BlockId;
import com.questrail.consensus.model.Wrapped;

import java.util.List;
import java.util.Objects;

/**
 * ProtocolEvent
 * -----------------------------------------------------------------------------
 * Stimuli delivered to the engine as if they came from the network.
 */
public sealed interface ProtocolEvent
        permits ProtocolEvent.ReceivedBlock, ProtocolEvent.ReceivedBlockHeader, ProtocolEvent.GetBlocks
{
    record ReceivedBlock(Wrapped<Block, BlockId> block) implements ProtocolEvent {
        public ReceivedBlock {
            Objects.requireNonNull(block, "block");
        }
    }

    record ReceivedBlockHeader(Wrapped<BlockHeader, BlockId> header) implements ProtocolEvent {
        public ReceivedBlockHeader {
            Objects.requireNonNull(header, "header");
        }

        public BlockId blockId() {
            return header.id();
        }
    }

    /** A peer asked for these blocks. */
    record GetBlocks(List<BlockId> blockIds) implements ProtocolEvent {
        public GetBlocks {
            blockIds = List.copyOf(blockIds);
        }
    }
}
