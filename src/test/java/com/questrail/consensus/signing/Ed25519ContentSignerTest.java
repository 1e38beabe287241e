package com.questrail.consensus.signing;

import com.questrail.consensus.engine.ConsensusConfig;
import com.questrail.consensus.model.Block;
import com.questrail.consensus.model.BlockHeader;
import com.questrail.consensus.model.BlockId;
import com.questrail.consensus.model.Endorsement;
import com.questrail.consensus.model.EndorsementId;
import com.questrail.consensus.model.Hash;
import com.questrail.consensus.model.Slot;
import com.questrail.consensus.model.Wrapped;
import com.questrail.consensus.test.tools.ConsensusTestTools;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Ed25519ContentSignerTest {

    private final ContentSigner signer = Ed25519ContentSigner.INSTANCE;
    private final KeyPair keys = KeyPairs.generate();

    private BlockHeader header(long period) {
        return new BlockHeader(Slot.of(period, 0), List.of(), Hash.compute("root"), List.of());
    }

    @Test
    void wrappedContentVerifies() {
        Wrapped<BlockHeader, BlockId> wrapped = signer.wrapHeader(header(1), keys);

        assertTrue(signer.verify(wrapped, Serializers.BLOCK_HEADER));
        assertEquals(keys.getPublic(), wrapped.creatorPublicKey());
    }

    @Test
    void signatureDoesNotCoverOtherContent() {
        Wrapped<BlockHeader, BlockId> signed = signer.wrapHeader(header(1), keys);
        Wrapped<BlockHeader, BlockId> swapped = new Wrapped<>(header(2), signed.signature(),
                signed.creatorPublicKey(), signed.id());

        assertFalse(signer.verify(swapped, Serializers.BLOCK_HEADER));
    }

    @Test
    void idDependsOnContentAndCreator() {
        BlockId first = signer.wrapHeader(header(1), keys).id();

        assertEquals(first, signer.wrapHeader(header(1), keys).id());
        assertNotEquals(first, signer.wrapHeader(header(2), keys).id());
        assertNotEquals(first, signer.wrapHeader(header(1), KeyPairs.generate()).id());
    }

    @Test
    void blockIdIsItsHeaderId() {
        Wrapped<Block, BlockId> block = ConsensusTestTools.createBlock(
                ConsensusConfig.defaults(), Slot.of(1, 0), List.of(), keys);

        assertEquals(block.content().header().id(), block.id());
        assertTrue(signer.verifyBlock(block));
    }

    @Test
    void endorsementsAreSignedIndependently() {
        BlockId endorsed = ConsensusTestTools.dummyBlockId("endorsed");
        Wrapped<Endorsement, EndorsementId> a = signer.wrapEndorsement(new Endorsement(Slot.of(1, 0), 0, endorsed), keys);
        Wrapped<Endorsement, EndorsementId> b = signer.wrapEndorsement(new Endorsement(Slot.of(1, 0), 1, endorsed), keys);

        assertTrue(signer.verify(a, Serializers.ENDORSEMENT));
        assertNotEquals(a.id(), b.id());
    }
}
