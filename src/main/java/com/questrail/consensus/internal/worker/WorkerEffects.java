package com.questrail.consensus.internal.worker;

import com.questrail.consensus.engine.ConsensusEvent;
import com.questrail.consensus.engine.pool.PoolCommand;
import com.questrail.consensus.engine.protocol.ProtocolCommand;
import com.questrail.consensus.model.Block;
import com.questrail.consensus.model.BlockId;
import com.questrail.consensus.model.Slot;
import com.questrail.consensus.model.Wrapped;
import com.questrail.consensus.observability.BlockDiscardedEvent;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * WorkerEffects
 * -----------------------------------------------------------------------------
 * Immutable list of side effects decided by {@link BlockGraphReducer}.
 *
 * <p>The reducer decides <b>what</b> must be emitted; the worker loop performs
 * the emission, in this order: storage, protocol, pool, execution, events.</p>
 */
record WorkerEffects(List<Wrapped<Block, BlockId>> blocksToStore,
                     List<ProtocolCommand> protocolCommands,
                     List<PoolCommand> poolCommands,
                     List<ExecutionUpdate> executionUpdates,
                     List<ConsensusEvent> consensusEvents,
                     List<Integrated> integrated,
                     List<Discarded> discarded) {

    /** One {@code updateBlockcliqueStatus} call. */
    record ExecutionUpdate(Map<Slot, BlockId> finalizedBlocks, Map<Slot, BlockId> blockclique) {
        ExecutionUpdate {
            finalizedBlocks = Map.copyOf(finalizedBlocks);
            blockclique = Map.copyOf(blockclique);
        }
    }

    record Integrated(BlockId blockId, Slot slot, boolean fromWaitingList) {}

    record Discarded(BlockId blockId, BlockDiscardedEvent.Reason reason) {}

    WorkerEffects {
        blocksToStore = List.copyOf(blocksToStore);
        protocolCommands = List.copyOf(protocolCommands);
        poolCommands = List.copyOf(poolCommands);
        executionUpdates = List.copyOf(executionUpdates);
        consensusEvents = List.copyOf(consensusEvents);
        integrated = List.copyOf(integrated);
        discarded = List.copyOf(discarded);
    }

    static WorkerEffects none() {
        return new Builder().build();
    }

    static Builder builder() {
        return new Builder();
    }

    static final class Builder {
        private final List<Wrapped<Block, BlockId>> blocksToStore = new ArrayList<>();
        private final List<ProtocolCommand> protocolCommands = new ArrayList<>();
        private final List<PoolCommand> poolCommands = new ArrayList<>();
        private final List<ExecutionUpdate> executionUpdates = new ArrayList<>();
        private final List<ConsensusEvent> consensusEvents = new ArrayList<>();
        private final List<Integrated> integrated = new ArrayList<>();
        private final List<Discarded> discarded = new ArrayList<>();

        // Wishlist changes are folded into a single delta per input.
        private final Set<BlockId> wishNew = new LinkedHashSet<>();
        private final Set<BlockId> wishRemove = new LinkedHashSet<>();

        Builder store(Wrapped<Block, BlockId> block) {
            blocksToStore.add(block);
            return this;
        }

        Builder protocol(ProtocolCommand command) {
            protocolCommands.add(command);
            return this;
        }

        Builder pool(PoolCommand command) {
            poolCommands.add(command);
            return this;
        }

        Builder execution(ExecutionUpdate update) {
            executionUpdates.add(update);
            return this;
        }

        Builder event(ConsensusEvent event) {
            consensusEvents.add(event);
            return this;
        }

        Builder integrated(BlockId id, Slot slot, boolean fromWaitingList) {
            integrated.add(new Integrated(id, slot, fromWaitingList));
            return this;
        }

        Builder discarded(BlockId id, BlockDiscardedEvent.Reason reason) {
            discarded.add(new Discarded(id, reason));
            return this;
        }

        Builder wish(BlockId id) {
            if (!wishRemove.remove(id)) {
                wishNew.add(id);
            }
            return this;
        }

        Builder unwish(BlockId id) {
            if (!wishNew.remove(id)) {
                wishRemove.add(id);
            }
            return this;
        }

        WorkerEffects build() {
            List<ProtocolCommand> commands = new ArrayList<>(protocolCommands);
            if (!wishNew.isEmpty() || !wishRemove.isEmpty()) {
                commands.add(new ProtocolCommand.WishlistDelta(wishNew, wishRemove));
            }
            return new WorkerEffects(blocksToStore, commands, poolCommands, executionUpdates,
                    consensusEvents, integrated, discarded);
        }
    }
}
