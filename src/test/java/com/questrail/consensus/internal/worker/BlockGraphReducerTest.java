package com.questrail.consensus.internal.worker;

import com.questrail.consensus.engine.ConsensusConfig;
import com.questrail.consensus.engine.ConsensusEvent;
import com.questrail.consensus.engine.pool.PoolCommand;
import com.questrail.consensus.engine.protocol.ProtocolCommand;
import com.questrail.consensus.engine.protocol.ProtocolEvent;
import com.questrail.consensus.model.Block;
import com.questrail.consensus.model.BlockId;
import com.questrail.consensus.model.Slot;
import com.questrail.consensus.model.Wrapped;
import com.questrail.consensus.observability.BlockDiscardedEvent.Reason;
import com.questrail.consensus.signing.Ed25519ContentSigner;
import com.questrail.consensus.signing.KeyPairs;
import com.questrail.consensus.test.tools.ConsensusTestTools;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BlockGraphReducerTest {

    private final ConsensusConfig config = ConsensusConfig.defaults();
    private final Map<BlockId, Wrapped<Block, BlockId>> storage = new HashMap<>();
    private final BlockGraphReducer reducer = new BlockGraphReducer(config, Ed25519ContentSigner.INSTANCE,
            id -> Optional.ofNullable(storage.get(id)));

    private final KeyPair creator = KeyPairs.generate();
    private BlockId g0;
    private BlockId g1;
    private BlockGraphState genesis;

    @BeforeEach
    void setUp() {
        KeyPair genesisKey = KeyPairs.generate();
        Wrapped<Block, BlockId> b0 = ConsensusTestTools.createBlock(config, Slot.of(0, 0), List.of(), genesisKey);
        Wrapped<Block, BlockId> b1 = ConsensusTestTools.createBlock(config, Slot.of(0, 1), List.of(), genesisKey);
        g0 = b0.id();
        g1 = b1.id();
        genesis = BlockGraphState.genesis(List.of(b0, b1), Slot.of(0, 0));
    }

    private Wrapped<Block, BlockId> block(long period, int thread, List<BlockId> parents) {
        return ConsensusTestTools.createBlock(config, Slot.of(period, thread), parents, creator);
    }

    private BlockGraphReducer.Result deliver(BlockGraphState state, Wrapped<Block, BlockId> block) {
        return reducer.apply(state, new WorkerInput.Inbound(new ProtocolEvent.ReceivedBlock(block)));
    }

    private static List<BlockId> integratedIds(WorkerEffects fx) {
        return fx.protocolCommands().stream()
                .filter(ProtocolCommand.IntegratedBlock.class::isInstance)
                .map(c -> ((ProtocolCommand.IntegratedBlock) c).blockId())
                .toList();
    }

    private static Optional<ProtocolCommand.WishlistDelta> wishlistDelta(WorkerEffects fx) {
        return fx.protocolCommands().stream()
                .filter(ProtocolCommand.WishlistDelta.class::isInstance)
                .map(ProtocolCommand.WishlistDelta.class::cast)
                .findFirst();
    }

    @Test
    void genesisStateIsFinalAndBestParents() {
        assertEquals(List.of(g0, g1), genesis.bestParents());
        assertEquals(List.of(g0, g1), genesis.genesisBlocks());
        assertTrue(genesis.activeBlocks().values().stream().allMatch(b -> b.isFinal()));
        assertEquals(List.of(0L, 0L), genesis.latestFinalPeriods());
    }

    @Test
    void blockOnActiveParentsIsIntegrated() {
        Wrapped<Block, BlockId> b = block(1, 0, List.of(g0, g1));

        BlockGraphReducer.Result r = deliver(genesis, b);

        assertEquals(List.of(b.id()), integratedIds(r.effects()));
        assertEquals(List.of(b), r.effects().blocksToStore());
        assertEquals(List.of(b.id(), g1), r.newState().bestParents());
        assertTrue(r.newState().isActive(b.id()));
        assertEquals(1, r.effects().executionUpdates().size());
        assertEquals(Map.of(Slot.of(1, 0), b.id()), r.effects().executionUpdates().get(0).blockclique());
        assertTrue(r.effects().discarded().isEmpty());
        assertFalse(genesis.isActive(b.id()), "reducer must not mutate its input");
    }

    @Test
    void knownBlockIsIgnored() {
        Wrapped<Block, BlockId> b = block(1, 0, List.of(g0, g1));
        BlockGraphState after = deliver(genesis, b).newState();

        BlockGraphReducer.Result again = deliver(after, b);

        assertSame(after, again.newState());
        assertTrue(again.effects().protocolCommands().isEmpty());
    }

    @Test
    void blockWithMissingParentIsParkedAndParentWished() {
        BlockId unknown = ConsensusTestTools.dummyBlockId("unknown");
        Wrapped<Block, BlockId> b = block(1, 0, List.of(unknown, g1));

        BlockGraphReducer.Result r = deliver(genesis, b);

        assertTrue(integratedIds(r.effects()).isEmpty());
        assertTrue(r.newState().waitingBlocks().containsKey(b.id()));
        assertEquals(Set.of(unknown), r.newState().wishlist());
        ProtocolCommand.WishlistDelta delta = wishlistDelta(r.effects()).orElseThrow();
        assertEquals(Set.of(unknown), delta.newBlocks());
        assertEquals(Set.of(), delta.remove());
    }

    @Test
    void parkedChildFollowsItsParent() {
        Wrapped<Block, BlockId> parent = block(1, 0, List.of(g0, g1));
        Wrapped<Block, BlockId> child = block(2, 0, List.of(parent.id(), g1));

        BlockGraphState parked = deliver(genesis, child).newState();
        BlockGraphReducer.Result r = deliver(parked, parent);

        assertEquals(List.of(parent.id(), child.id()), integratedIds(r.effects()));
        assertEquals(List.of(
                new WorkerEffects.Integrated(parent.id(), Slot.of(1, 0), false),
                new WorkerEffects.Integrated(child.id(), Slot.of(2, 0), true)), r.effects().integrated());
        assertTrue(r.newState().waitingBlocks().isEmpty());
        assertTrue(r.newState().wishlist().isEmpty());
        ProtocolCommand.WishlistDelta delta = wishlistDelta(r.effects()).orElseThrow();
        assertEquals(Set.of(), delta.newBlocks());
        assertEquals(Set.of(parent.id()), delta.remove());
        assertEquals(child.id(), r.newState().bestParents().get(0));
    }

    @Test
    void headerOfUnknownBlockIsWishedOnce() {
        Wrapped<Block, BlockId> b = block(1, 0, List.of(g0, g1));
        ProtocolEvent header = new ProtocolEvent.ReceivedBlockHeader(b.content().header());

        BlockGraphReducer.Result first = reducer.apply(genesis, new WorkerInput.Inbound(header));
        BlockGraphReducer.Result second = reducer.apply(first.newState(), new WorkerInput.Inbound(header));

        assertEquals(Set.of(b.id()), wishlistDelta(first.effects()).orElseThrow().newBlocks());
        assertTrue(second.effects().protocolCommands().isEmpty());
    }

    @Test
    void headerOfActiveBlockIsIgnored() {
        ProtocolEvent header = new ProtocolEvent.ReceivedBlockHeader(
                genesis.activeBlock(g0).orElseThrow().content().header());

        BlockGraphReducer.Result r = reducer.apply(genesis, new WorkerInput.Inbound(header));

        assertTrue(r.effects().protocolCommands().isEmpty());
    }

    @Test
    void wishedBlockIsUnwishedOnArrival() {
        Wrapped<Block, BlockId> b = block(1, 0, List.of(g0, g1));
        BlockGraphState wished = reducer.apply(genesis,
                new WorkerInput.Inbound(new ProtocolEvent.ReceivedBlockHeader(b.content().header()))).newState();

        BlockGraphReducer.Result r = deliver(wished, b);

        assertEquals(List.of(b.id()), integratedIds(r.effects()));
        assertEquals(Set.of(b.id()), wishlistDelta(r.effects()).orElseThrow().remove());
    }

    @Test
    void invalidSignatureIsDiscarded() {
        Wrapped<Block, BlockId> b = block(1, 0, List.of(g0, g1));
        byte[] otherSignature = block(1, 1, List.of(g0, g1)).signature();
        Wrapped<Block, BlockId> forged = new Wrapped<>(b.content(), otherSignature, b.creatorPublicKey(), b.id());

        BlockGraphReducer.Result r = deliver(genesis, forged);

        assertEquals(List.of(new WorkerEffects.Discarded(b.id(), Reason.INVALID_SIGNATURE)), r.effects().discarded());
        assertFalse(r.newState().isKnown(b.id()));
    }

    @Test
    void wrongParentCountIsDiscarded() {
        Wrapped<Block, BlockId> b = block(1, 0, List.of(g0));

        BlockGraphReducer.Result r = deliver(genesis, b);

        assertEquals(List.of(new WorkerEffects.Discarded(b.id(), Reason.WRONG_PARENT_COUNT)), r.effects().discarded());
    }

    @Test
    void threadOutOfRangeIsDiscarded() {
        Wrapped<Block, BlockId> b = block(1, 5, List.of(g0, g1));

        BlockGraphReducer.Result r = deliver(genesis, b);

        assertEquals(Reason.INVALID_SLOT, r.effects().discarded().get(0).reason());
    }

    @Test
    void swappedParentsAreIncompatible() {
        Wrapped<Block, BlockId> b = block(1, 0, List.of(g1, g0));

        BlockGraphReducer.Result r = deliver(genesis, b);

        assertEquals(List.of(new WorkerEffects.Discarded(b.id(), Reason.INCOMPATIBLE_PARENTS)),
                r.effects().discarded());
        assertFalse(r.newState().isActive(b.id()));
    }

    @Test
    void blockTooFarInTheFutureRequestsResync() {
        Wrapped<Block, BlockId> b = block(config.maxFuturePeriods() + 1, 0, List.of(g0, g1));

        BlockGraphReducer.Result r = deliver(genesis, b);

        assertEquals(Reason.TOO_FAR_IN_FUTURE, r.effects().discarded().get(0).reason());
        assertEquals(List.of(new ConsensusEvent.NeedSync()), r.effects().consensusEvents());
    }

    @Test
    void secondBlockOfCreatorInSlotIsAnAttack() {
        Wrapped<Block, BlockId> first = block(1, 0, List.of(g0, g1));
        Wrapped<Block, BlockId> twin = ConsensusTestTools.createBlockWithMerkleRoot(config,
                ConsensusTestTools.merkleRoot(List.of()), Slot.of(1, 0), List.of(g0, g1), creator);
        BlockGraphState after = deliver(genesis, first).newState();

        BlockGraphReducer.Result r = deliver(after, twin);

        assertEquals(List.of(new ProtocolCommand.AttackBlockDetected(twin.id())), r.effects().protocolCommands());
        assertEquals(Reason.MULTISTAKING, r.effects().discarded().get(0).reason());
    }

    @Test
    void oldBlocksOfThreadBecomeFinal() {
        BlockGraphState state = genesis;
        BlockId previous = g0;
        BlockId first = null;
        BlockGraphReducer.Result r = null;
        for (long period = 1; period <= 4; period++) {
            Wrapped<Block, BlockId> b = block(period, 0, List.of(previous, g1));
            r = deliver(state, b);
            state = r.newState();
            previous = b.id();
            if (first == null) {
                first = b.id();
            }
        }

        assertTrue(state.activeBlocks().get(first).isFinal());
        assertEquals(List.of(1L, 0L), state.latestFinalPeriods());
        assertEquals(List.of(new PoolCommand.UpdateLatestFinalPeriods(List.of(1L, 0L))), r.effects().poolCommands());
        WorkerEffects.ExecutionUpdate update = r.effects().executionUpdates().get(0);
        assertEquals(Map.of(Slot.of(1, 0), first), update.finalizedBlocks());
        assertEquals(3, update.blockclique().size());
        assertFalse(update.blockclique().containsValue(first));
    }

    @Test
    void newerSlotTickUpdatesPool() {
        BlockGraphReducer.Result r = reducer.apply(genesis, new WorkerInput.SlotTick(Slot.of(0, 1)));

        assertEquals(Slot.of(0, 1), r.newState().currentSlot());
        assertEquals(List.of(new PoolCommand.UpdateCurrentSlot(Slot.of(0, 1))), r.effects().poolCommands());

        BlockGraphReducer.Result stale = reducer.apply(r.newState(), new WorkerInput.SlotTick(Slot.of(0, 0)));
        assertSame(r.newState(), stale.newState());
        assertTrue(stale.effects().poolCommands().isEmpty());
    }

    @Test
    void getBlocksLooksInGraphThenStorage() {
        Wrapped<Block, BlockId> stored = block(9, 1, List.of(g0, g1));
        storage.put(stored.id(), stored);
        BlockId missing = ConsensusTestTools.dummyBlockId("missing");

        BlockGraphReducer.Result r = reducer.apply(genesis, new WorkerInput.Inbound(
                new ProtocolEvent.GetBlocks(List.of(g0, stored.id(), missing))));

        ProtocolCommand.GetBlocksResults results = (ProtocolCommand.GetBlocksResults) r.effects().protocolCommands().get(0);
        assertTrue(results.results().get(g0).isPresent());
        assertEquals(Optional.of(stored), results.results().get(stored.id()));
        assertEquals(Optional.empty(), results.results().get(missing));
    }
}
