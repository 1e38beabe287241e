package com.questrail.consensus.internal.worker;

import com.questrail.consensus.engine.BlockGraphExport;
import com.questrail.consensus.engine.BootstrapableGraph;
import com.questrail.consensus.engine.Clique;
import com.questrail.consensus.engine.ConsensusStartException;
import com.questrail.consensus.engine.ExportActiveBlock;
import com.questrail.consensus.model.Address;
import com.questrail.consensus.model.Block;
import com.questrail.consensus.model.BlockId;
import com.questrail.consensus.model.Slot;
import com.questrail.consensus.model.Wrapped;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * BlockGraphState
 * =============================================================================
 * Immutable snapshot of the reference worker's block graph.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>active blocks: integrated, with their parent periods and finality</li>
 *   <li>best parent per thread</li>
 *   <li>blocks waiting for missing parents</li>
 *   <li>the wishlist: ids asked of the protocol and not yet received</li>
 *   <li>which block each creator produced for each slot</li>
 *   <li>latest final period per thread and the current slot</li>
 * </ul>
 *
 * <p>Instances are replaced, never mutated. {@link BlockGraphReducer} derives
 * new states through {@link #edit()}.</p>
 */
final class BlockGraphState
{
    /** Key of the one block a creator may produce for a slot. */
    record SlotCreator(Slot slot, Address creator) {}

    private final List<BlockId> genesisBlocks;
    private final Map<BlockId, ExportActiveBlock> activeBlocks;
    private final List<BlockId> bestParents;
    private final Map<BlockId, Wrapped<Block, BlockId>> waitingBlocks;
    private final Set<BlockId> wishlist;
    private final Map<SlotCreator, BlockId> slotCreators;
    private final List<Long> latestFinalPeriods;
    private final Slot currentSlot;

    private BlockGraphState(List<BlockId> genesisBlocks,
                            Map<BlockId, ExportActiveBlock> activeBlocks,
                            List<BlockId> bestParents,
                            Map<BlockId, Wrapped<Block, BlockId>> waitingBlocks,
                            Set<BlockId> wishlist,
                            Map<SlotCreator, BlockId> slotCreators,
                            List<Long> latestFinalPeriods,
                            Slot currentSlot) {
        this.genesisBlocks = List.copyOf(genesisBlocks);
        this.activeBlocks = Collections.unmodifiableMap(new LinkedHashMap<>(activeBlocks));
        this.bestParents = List.copyOf(bestParents);
        this.waitingBlocks = Collections.unmodifiableMap(new LinkedHashMap<>(waitingBlocks));
        this.wishlist = Collections.unmodifiableSet(new LinkedHashSet<>(wishlist));
        this.slotCreators = Map.copyOf(slotCreators);
        this.latestFinalPeriods = List.copyOf(latestFinalPeriods);
        this.currentSlot = Objects.requireNonNull(currentSlot, "currentSlot");
    }

    /**
     * Fresh graph made of one genesis block per thread.
     *
     * @param genesis genesis blocks, indexed by thread
     */
    static BlockGraphState genesis(List<Wrapped<Block, BlockId>> genesis, Slot currentSlot) {
        Map<BlockId, ExportActiveBlock> active = new LinkedHashMap<>();
        List<BlockId> ids = new ArrayList<>();
        List<Long> finalPeriods = new ArrayList<>();
        for (Wrapped<Block, BlockId> block : genesis) {
            active.put(block.id(), new ExportActiveBlock(block, List.of(), true));
            ids.add(block.id());
            finalPeriods.add(0L);
        }
        return new BlockGraphState(ids, active, ids, Map.of(), Set.of(),
                slotCreatorsOf(active.values()), finalPeriods, currentSlot);
    }

    /**
     * Graph restored from bootstrap state.
     *
     * @throws ConsensusStartException if the graph does not name a best parent
     *         per thread, or names one that is not active
     */
    static BlockGraphState fromBootstrap(BootstrapableGraph graph, int threadCount, Slot currentSlot) {
        if (graph.bestParents().size() != threadCount) {
            throw new ConsensusStartException("bootstrap graph has " + graph.bestParents().size()
                    + " best parent(s), expected " + threadCount);
        }
        for (BlockId id : graph.bestParents()) {
            if (!graph.activeBlocks().containsKey(id)) {
                throw new ConsensusStartException("bootstrap best parent " + id + " is not an active block");
            }
        }

        BlockId[] genesis = new BlockId[threadCount];
        Long[] finalPeriods = new Long[threadCount];
        for (ExportActiveBlock block : graph.activeBlocks().values()) {
            Slot slot = block.slot();
            if (slot.thread() >= threadCount) {
                throw new ConsensusStartException("bootstrap block " + block.blockId()
                        + " is in thread " + slot.thread() + " of " + threadCount);
            }
            if (slot.period() == 0) {
                genesis[slot.thread()] = block.blockId();
            }
            if (block.isFinal()) {
                Long previous = finalPeriods[slot.thread()];
                if (previous == null || previous < slot.period()) {
                    finalPeriods[slot.thread()] = slot.period();
                }
            }
        }
        List<BlockId> genesisIds = new ArrayList<>();
        List<Long> periods = new ArrayList<>();
        for (int t = 0; t < threadCount; t++) {
            if (genesis[t] != null) {
                genesisIds.add(genesis[t]);
            }
            periods.add(finalPeriods[t] == null ? 0L : finalPeriods[t]);
        }
        return new BlockGraphState(genesisIds, graph.activeBlocks(), graph.bestParents(), Map.of(),
                Set.of(), slotCreatorsOf(graph.activeBlocks().values()), periods, currentSlot);
    }

    private static Map<SlotCreator, BlockId> slotCreatorsOf(Iterable<ExportActiveBlock> blocks) {
        Map<SlotCreator, BlockId> out = new HashMap<>();
        for (ExportActiveBlock block : blocks) {
            out.put(new SlotCreator(block.slot(), block.block().creatorAddress()), block.blockId());
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    List<BlockId> genesisBlocks() { return genesisBlocks; }
    Map<BlockId, ExportActiveBlock> activeBlocks() { return activeBlocks; }
    List<BlockId> bestParents() { return bestParents; }
    Map<BlockId, Wrapped<Block, BlockId>> waitingBlocks() { return waitingBlocks; }
    Set<BlockId> wishlist() { return wishlist; }
    Map<SlotCreator, BlockId> slotCreators() { return slotCreators; }
    List<Long> latestFinalPeriods() { return latestFinalPeriods; }
    Slot currentSlot() { return currentSlot; }

    boolean isActive(BlockId id) {
        return activeBlocks.containsKey(id);
    }

    /** Active or waiting. */
    boolean isKnown(BlockId id) {
        return activeBlocks.containsKey(id) || waitingBlocks.containsKey(id);
    }

    Optional<Wrapped<Block, BlockId>> activeBlock(BlockId id) {
        ExportActiveBlock block = activeBlocks.get(id);
        return block == null ? Optional.empty() : Optional.of(block.block());
    }

    /**
     * Snapshot answered to graph status queries. The whole active set is
     * reported as a single clique.
     */
    BlockGraphExport export() {
        Clique clique = new Clique(activeBlocks.keySet(), true);
        return new BlockGraphExport(genesisBlocks, activeBlocks, bestParents, latestFinalPeriods,
                List.of(clique));
    }

    Editor edit() {
        return new Editor(this);
    }

    /**
     * Mutable working copy of a state. Used within a single reduction only.
     */
    static final class Editor
    {
        private final List<BlockId> genesisBlocks;
        final Map<BlockId, ExportActiveBlock> activeBlocks;
        final List<BlockId> bestParents;
        final Map<BlockId, Wrapped<Block, BlockId>> waitingBlocks;
        final Set<BlockId> wishlist;
        final Map<SlotCreator, BlockId> slotCreators;
        final List<Long> latestFinalPeriods;
        Slot currentSlot;

        private Editor(BlockGraphState s) {
            this.genesisBlocks = s.genesisBlocks;
            this.activeBlocks = new LinkedHashMap<>(s.activeBlocks);
            this.bestParents = new ArrayList<>(s.bestParents);
            this.waitingBlocks = new LinkedHashMap<>(s.waitingBlocks);
            this.wishlist = new LinkedHashSet<>(s.wishlist);
            this.slotCreators = new HashMap<>(s.slotCreators);
            this.latestFinalPeriods = new ArrayList<>(s.latestFinalPeriods);
            this.currentSlot = s.currentSlot;
        }

        BlockGraphState build() {
            return new BlockGraphState(genesisBlocks, activeBlocks, bestParents, waitingBlocks,
                    wishlist, slotCreators, latestFinalPeriods, currentSlot);
        }
    }
}
