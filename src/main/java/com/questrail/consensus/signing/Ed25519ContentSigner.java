package com.questrail.consensus.signing;

import com.questrail.consensus.model.ContentId;
import com.questrail.consensus.model.Hash;
import com.questrail.consensus.model.Wrapped;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PublicKey;
import java.security.Signature;
import java.util.Objects;

/**
 * {@link ContentSigner} using JDK Ed25519 signatures and SHA-256 content hashes.
 */
public enum Ed25519ContentSigner implements ContentSigner {
    INSTANCE;

    static final String ALGORITHM = "Ed25519";

    @Override
    public <T, I extends ContentId> Wrapped<T, I> wrap(T content,
                                                       ContentSerializer<T> serializer,
                                                       IdDerivation<T, I> ids,
                                                       KeyPair keys) {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(serializer, "serializer");
        Objects.requireNonNull(ids, "ids");
        Objects.requireNonNull(keys, "keys");

        Hash contentHash = contentHash(serializer.serialize(content), keys.getPublic());
        try {
            Signature signer = Signature.getInstance(ALGORITHM);
            signer.initSign(keys.getPrivate());
            signer.update(contentHash.toBytes());
            byte[] signature = signer.sign();
            return new Wrapped<>(content, signature, keys.getPublic(), ids.derive(content, contentHash));
        } catch (GeneralSecurityException e) {
            throw new SigningException("could not sign " + content.getClass().getSimpleName(), e);
        }
    }

    @Override
    public <T> boolean verify(Wrapped<T, ?> wrapped, ContentSerializer<T> serializer) {
        Objects.requireNonNull(wrapped, "wrapped");
        Hash contentHash = contentHash(serializer.serialize(wrapped.content()), wrapped.creatorPublicKey());
        try {
            Signature verifier = Signature.getInstance(ALGORITHM);
            verifier.initVerify(wrapped.creatorPublicKey());
            verifier.update(contentHash.toBytes());
            return verifier.verify(wrapped.signature());
        } catch (GeneralSecurityException e) {
            throw new SigningException("could not verify " + wrapped, e);
        }
    }

    private static Hash contentHash(byte[] serialized, PublicKey creator) {
        byte[] key = creator.getEncoded();
        byte[] input = new byte[serialized.length + key.length];
        System.arraycopy(serialized, 0, input, 0, serialized.length);
        System.arraycopy(key, 0, input, serialized.length, key.length);
        return Hash.compute(input);
    }
}
