package com.questrail.consensus.signing;

import com.questrail.consensus.model.Block;
import com.questrail.consensus.model.BlockHeader;
import com.questrail.consensus.model.BlockId;
import com.questrail.consensus.model.ContentId;
import com.questrail.consensus.model.Endorsement;
import com.questrail.consensus.model.EndorsementId;
import com.questrail.consensus.model.Operation;
import com.questrail.consensus.model.OperationId;
import com.questrail.consensus.model.Wrapped;

import java.security.KeyPair;

/**
 * ContentSigner
 * =============================================================================
 * The content-signing collaborator: given a payload and a key pair, produce a
 * signed, content-addressed {@link Wrapped} object.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>The content hash covers the serialized payload and the creator's
 *       public key.</li>
 *   <li>The signature is computed over the content hash.</li>
 *   <li>The identifier is derived from the payload and its content hash; a
 *       block takes the identifier of its header.</li>
 * </ul>
 */
public interface ContentSigner
{
    <T, I extends ContentId> Wrapped<T, I> wrap(T content,
                                                ContentSerializer<T> serializer,
                                                IdDerivation<T, I> ids,
                                                KeyPair keys);

    /**
     * Checks the signature of a wrapped payload against its creator's key.
     */
    <T> boolean verify(Wrapped<T, ?> wrapped, ContentSerializer<T> serializer);

    default Wrapped<BlockHeader, BlockId> wrapHeader(BlockHeader header, KeyPair keys) {
        return wrap(header, Serializers.BLOCK_HEADER, (h, hash) -> new BlockId(hash), keys);
    }

    default Wrapped<Block, BlockId> wrapBlock(Block block, KeyPair keys) {
        return wrap(block, Serializers.BLOCK, (b, hash) -> b.header().id(), keys);
    }

    default Wrapped<Operation, OperationId> wrapOperation(Operation operation, KeyPair keys) {
        return wrap(operation, Serializers.OPERATION, (o, hash) -> new OperationId(hash), keys);
    }

    default Wrapped<Endorsement, EndorsementId> wrapEndorsement(Endorsement endorsement, KeyPair keys) {
        return wrap(endorsement, Serializers.ENDORSEMENT, (e, hash) -> new EndorsementId(hash), keys);
    }

    /**
     * Verifies a block and the header it carries.
     */
    default boolean verifyBlock(Wrapped<Block, BlockId> block) {
        return verify(block.content().header(), Serializers.BLOCK_HEADER)
                && verify(block, Serializers.BLOCK);
    }
}
