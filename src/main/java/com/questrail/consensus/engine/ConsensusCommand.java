package com.questrail.consensus.engine;

import com.questrail.consensus.model.Address;
import com.questrail.consensus.model.Block;
import com.questrail.consensus.model.BlockId;
import com.questrail.consensus.model.Wrapped;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Queries sent to a running engine. Each carries the future the engine
 * completes with its answer.
 */
public sealed interface ConsensusCommand
        permits ConsensusCommand.GetBlockGraphStatus, ConsensusCommand.GetActiveBlock,
                ConsensusCommand.GetStakingAddresses, ConsensusCommand.GetStakers
{
    CompletableFuture<?> reply();

    record GetBlockGraphStatus(CompletableFuture<BlockGraphExport> reply) implements ConsensusCommand {
        public GetBlockGraphStatus {
            Objects.requireNonNull(reply, "reply");
        }
    }

    record GetActiveBlock(BlockId blockId,
                          CompletableFuture<Optional<Wrapped<Block, BlockId>>> reply) implements ConsensusCommand {
        public GetActiveBlock {
            Objects.requireNonNull(blockId, "blockId");
            Objects.requireNonNull(reply, "reply");
        }
    }

    record GetStakingAddresses(CompletableFuture<Set<Address>> reply) implements ConsensusCommand {
        public GetStakingAddresses {
            Objects.requireNonNull(reply, "reply");
        }
    }

    record GetStakers(CompletableFuture<Map<Address, Long>> reply) implements ConsensusCommand {
        public GetStakers {
            Objects.requireNonNull(reply, "reply");
        }
    }
}
