package com.questrail.consensus.model;

import java.security.PublicKey;
import java.util.Arrays;
import java.util.Objects;

/**
 * Wrapped
 * -----------------------------------------------------------------------------
 * A signed, content-addressed envelope around a payload.
 *
 * <p>Instances are produced by the content-signing collaborator
 * ({@code com.questrail.consensus.signing.ContentSigner}); this class only
 * carries the result. Two envelopes are equal when their identifiers and
 * signatures are equal.</p>
 *
 * @param <T> payload type
 * @param <I> identifier type
 */
public final class Wrapped<T, I extends ContentId>
{
    private final T content;
    private final byte[] signature;
    private final PublicKey creatorPublicKey;
    private final Address creatorAddress;
    private final I id;

    public Wrapped(T content, byte[] signature, PublicKey creatorPublicKey, I id)
    {
        this.content = Objects.requireNonNull(content, "content");
        this.signature = Objects.requireNonNull(signature, "signature").clone();
        this.creatorPublicKey = Objects.requireNonNull(creatorPublicKey, "creatorPublicKey");
        this.creatorAddress = Address.fromPublicKey(creatorPublicKey);
        this.id = Objects.requireNonNull(id, "id");
    }

    public T content() {
        return content;
    }

    public byte[] signature() {
        return signature.clone();
    }

    public PublicKey creatorPublicKey() {
        return creatorPublicKey;
    }

    public Address creatorAddress() {
        return creatorAddress;
    }

    public I id() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Wrapped<?, ?> that)) return false;
        return id.equals(that.id) && Arrays.equals(signature, that.signature);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Wrapped[" + id + " by " + creatorAddress + "]";
    }
}
