package com.questrail.consensus.internal.worker;

import com.questrail.consensus.engine.ConsensusConfig;
import com.questrail.consensus.engine.ConsensusEvent;
import com.questrail.consensus.engine.ExportActiveBlock;
import com.questrail.consensus.engine.pool.PoolCommand;
import com.questrail.consensus.engine.protocol.ProtocolCommand;
import com.questrail.consensus.engine.protocol.ProtocolEvent;
import com.questrail.consensus.model.Block;
import com.questrail.consensus.model.BlockHeader;
import com.questrail.consensus.model.BlockId;
import com.questrail.consensus.model.EndorsementId;
import com.questrail.consensus.model.OperationId;
import com.questrail.consensus.model.Slot;
import com.questrail.consensus.model.Wrapped;
import com.questrail.consensus.observability.BlockDiscardedEvent.Reason;
import com.questrail.consensus.signing.ContentSigner;
import com.questrail.consensus.signing.Serializers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * BlockGraphReducer
 * =============================================================================
 * Pure decision logic of the reference consensus worker.
 *
 * <p>Given the current {@link BlockGraphState} and one {@link WorkerInput},
 * the reducer returns the next state and the effects to perform. It performs
 * no I/O: it never sends on a channel, writes storage or logs. The only
 * outside state it reads is the shared block storage, through the lookup it
 * was constructed with, when answering block requests.</p>
 *
 * <h2>Incoming block</h2>
 * <ol>
 *   <li>Already active or waiting: ignored.</li>
 *   <li>Bad signature, slot thread out of range or wrong parent count:
 *       discarded.</li>
 *   <li>Too far ahead of the current slot: discarded and a resync is
 *       requested.</li>
 *   <li>Same creator and slot as a different known block: discarded and
 *       reported as an attack.</li>
 *   <li>Parents not all active: parked, missing parents are wished for.</li>
 *   <li>Parents incompatible (wrong thread, not earlier): discarded.</li>
 *   <li>Otherwise integrated; parked blocks that became ready follow.</li>
 * </ol>
 */
final class BlockGraphReducer
{
    record Result(BlockGraphState newState, WorkerEffects effects) {
        Result {
            Objects.requireNonNull(newState, "newState");
            Objects.requireNonNull(effects, "effects");
        }
    }

    private final ConsensusConfig config;
    private final ContentSigner signer;
    private final Function<BlockId, Optional<Wrapped<Block, BlockId>>> storageLookup;

    BlockGraphReducer(ConsensusConfig config,
                      ContentSigner signer,
                      Function<BlockId, Optional<Wrapped<Block, BlockId>>> storageLookup) {
        this.config = Objects.requireNonNull(config, "config");
        this.signer = Objects.requireNonNull(signer, "signer");
        this.storageLookup = Objects.requireNonNull(storageLookup, "storageLookup");
    }

    Result apply(BlockGraphState state, WorkerInput input) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(input, "input");

        if (input instanceof WorkerInput.SlotTick tick) {
            return onSlotTick(state, tick.slot());
        }
        ProtocolEvent event = ((WorkerInput.Inbound) input).event();
        if (event instanceof ProtocolEvent.ReceivedBlock received) {
            return onBlock(state, received.block());
        }
        if (event instanceof ProtocolEvent.ReceivedBlockHeader received) {
            return onHeader(state, received.header());
        }
        if (event instanceof ProtocolEvent.GetBlocks request) {
            return onGetBlocks(state, request.blockIds());
        }
        throw new IllegalArgumentException("Unhandled protocol event: " + event);
    }

    // ---------------------------------------------------------------------
    // Clock
    // ---------------------------------------------------------------------

    private Result onSlotTick(BlockGraphState state, Slot slot) {
        if (slot.compareTo(state.currentSlot()) <= 0) {
            return new Result(state, WorkerEffects.none());
        }
        BlockGraphState.Editor e = state.edit();
        e.currentSlot = slot;
        WorkerEffects fx = WorkerEffects.builder()
                .pool(new PoolCommand.UpdateCurrentSlot(slot))
                .build();
        return new Result(e.build(), fx);
    }

    // ---------------------------------------------------------------------
    // Protocol requests
    // ---------------------------------------------------------------------

    private Result onGetBlocks(BlockGraphState state, List<BlockId> ids) {
        Map<BlockId, Optional<Wrapped<Block, BlockId>>> results = new LinkedHashMap<>();
        for (BlockId id : ids) {
            Optional<Wrapped<Block, BlockId>> found = state.activeBlock(id);
            if (found.isEmpty()) {
                found = storageLookup.apply(id);
            }
            results.put(id, found);
        }
        WorkerEffects fx = WorkerEffects.builder()
                .protocol(new ProtocolCommand.GetBlocksResults(results))
                .build();
        return new Result(state, fx);
    }

    private Result onHeader(BlockGraphState state, Wrapped<BlockHeader, BlockId> header) {
        BlockId id = header.id();
        if (state.isKnown(id) || state.wishlist().contains(id)) {
            return new Result(state, WorkerEffects.none());
        }
        WorkerEffects.Builder fx = WorkerEffects.builder();
        if (!signer.verify(header, Serializers.BLOCK_HEADER)) {
            fx.discarded(id, Reason.INVALID_SIGNATURE);
            return new Result(state, fx.build());
        }
        BlockGraphState.Editor e = state.edit();
        e.wishlist.add(id);
        fx.wish(id);
        return new Result(e.build(), fx.build());
    }

    // ---------------------------------------------------------------------
    // Blocks
    // ---------------------------------------------------------------------

    private Result onBlock(BlockGraphState state, Wrapped<Block, BlockId> block) {
        BlockId id = block.id();
        if (state.isKnown(id)) {
            return new Result(state, WorkerEffects.none());
        }

        WorkerEffects.Builder fx = WorkerEffects.builder();
        if (!signer.verifyBlock(block)) {
            fx.discarded(id, Reason.INVALID_SIGNATURE);
            return new Result(state, fx.build());
        }

        BlockGraphState.Editor e = state.edit();
        if (e.wishlist.remove(id)) {
            fx.unwish(id);
        }

        Slot slot = block.content().slot();
        if (slot.thread() >= config.threadCount()) {
            fx.discarded(id, Reason.INVALID_SLOT);
            return new Result(e.build(), fx.build());
        }
        if (block.content().parents().size() != config.threadCount()) {
            fx.discarded(id, Reason.WRONG_PARENT_COUNT);
            return new Result(e.build(), fx.build());
        }
        if (slot.period() > e.currentSlot.period() + config.maxFuturePeriods()) {
            fx.discarded(id, Reason.TOO_FAR_IN_FUTURE);
            fx.event(new ConsensusEvent.NeedSync());
            return new Result(e.build(), fx.build());
        }

        BlockGraphState.SlotCreator key = new BlockGraphState.SlotCreator(slot, block.creatorAddress());
        BlockId previous = e.slotCreators.get(key);
        if (previous != null && !previous.equals(id)) {
            fx.discarded(id, Reason.MULTISTAKING);
            fx.protocol(new ProtocolCommand.AttackBlockDetected(id));
            return new Result(e.build(), fx.build());
        }

        List<BlockId> missing = new ArrayList<>();
        for (BlockId parent : block.content().parents()) {
            if (!e.activeBlocks.containsKey(parent)) {
                missing.add(parent);
            }
        }
        if (!missing.isEmpty()) {
            e.waitingBlocks.put(id, block);
            e.slotCreators.put(key, id);
            for (BlockId parent : missing) {
                if (!e.waitingBlocks.containsKey(parent) && e.wishlist.add(parent)) {
                    fx.wish(parent);
                }
            }
            return new Result(e.build(), fx.build());
        }

        if (integrate(e, block, false, fx)) {
            integrateReadyWaitingBlocks(e, fx);
        }
        return new Result(e.build(), fx.build());
    }

    /**
     * Integrates parked blocks whose parents are now all active, oldest slot
     * first, until no parked block becomes ready.
     */
    private void integrateReadyWaitingBlocks(BlockGraphState.Editor e, WorkerEffects.Builder fx) {
        while (true) {
            List<Wrapped<Block, BlockId>> ready = new ArrayList<>();
            for (Wrapped<Block, BlockId> waiting : e.waitingBlocks.values()) {
                if (e.activeBlocks.keySet().containsAll(waiting.content().parents())) {
                    ready.add(waiting);
                }
            }
            if (ready.isEmpty()) {
                return;
            }
            ready.sort(Comparator.comparing(b -> b.content().slot()));
            for (Wrapped<Block, BlockId> block : ready) {
                e.waitingBlocks.remove(block.id());
                if (!integrate(e, block, true, fx)) {
                    e.slotCreators.remove(new BlockGraphState.SlotCreator(
                            block.content().slot(), block.creatorAddress()), block.id());
                }
            }
        }
    }

    /**
     * Integrates a block whose parents are all active.
     *
     * @return {@code false} when the block was discarded for incompatible parents
     */
    private boolean integrate(BlockGraphState.Editor e,
                              Wrapped<Block, BlockId> block,
                              boolean fromWaitingList,
                              WorkerEffects.Builder fx) {
        Block content = block.content();
        Slot slot = content.slot();

        List<ExportActiveBlock.ParentRef> parentRefs = new ArrayList<>();
        for (int thread = 0; thread < content.parents().size(); thread++) {
            ExportActiveBlock parent = e.activeBlocks.get(content.parents().get(thread));
            if (parent.slot().thread() != thread || parent.slot().compareTo(slot) >= 0) {
                fx.discarded(block.id(), Reason.INCOMPATIBLE_PARENTS);
                return false;
            }
            parentRefs.add(new ExportActiveBlock.ParentRef(parent.blockId(), parent.slot().period()));
        }

        e.activeBlocks.put(block.id(), new ExportActiveBlock(block, parentRefs, false));
        e.slotCreators.put(new BlockGraphState.SlotCreator(slot, block.creatorAddress()), block.id());
        fx.store(block);

        ExportActiveBlock best = e.activeBlocks.get(e.bestParents.get(slot.thread()));
        if (best == null || best.slot().period() < slot.period()) {
            e.bestParents.set(slot.thread(), block.id());
        }

        Set<OperationId> operationIds = new LinkedHashSet<>();
        content.operations().forEach(op -> operationIds.add(op.id()));
        List<EndorsementId> endorsementIds = new ArrayList<>();
        content.header().content().endorsements().forEach(en -> endorsementIds.add(en.id()));
        fx.protocol(new ProtocolCommand.IntegratedBlock(block.id(), operationIds, endorsementIds));
        fx.integrated(block.id(), slot, fromWaitingList);

        applyFinality(e, slot, fx);
        return true;
    }

    /**
     * Marks final every non-final block of the integrated block's thread that
     * is at least {@code finalityDepth} periods older, then reports the new
     * blockclique to execution.
     */
    private void applyFinality(BlockGraphState.Editor e, Slot integrated, WorkerEffects.Builder fx) {
        Map<Slot, BlockId> finalized = new HashMap<>();
        long finalPeriod = e.latestFinalPeriods.get(integrated.thread());
        for (ExportActiveBlock active : List.copyOf(e.activeBlocks.values())) {
            Slot s = active.slot();
            if (active.isFinal() || s.thread() != integrated.thread()) {
                continue;
            }
            if (s.period() + config.finalityDepth() <= integrated.period()) {
                e.activeBlocks.put(active.blockId(),
                        new ExportActiveBlock(active.block(), active.parents(), true));
                finalized.put(s, active.blockId());
                finalPeriod = Math.max(finalPeriod, s.period());
            }
        }
        if (!finalized.isEmpty()) {
            e.latestFinalPeriods.set(integrated.thread(), finalPeriod);
            fx.pool(new PoolCommand.UpdateLatestFinalPeriods(e.latestFinalPeriods));
        }

        Map<Slot, BlockId> blockclique = new HashMap<>();
        for (ExportActiveBlock active : e.activeBlocks.values()) {
            if (!active.isFinal()) {
                blockclique.putIfAbsent(active.slot(), active.blockId());
            }
        }
        fx.execution(new WorkerEffects.ExecutionUpdate(finalized, blockclique));
    }
}
