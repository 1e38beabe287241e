package com.questrail.consensus.model;

import java.security.PublicKey;
import java.util.Objects;

/**
 * Account address: the hash of a public key.
 */
public record Address(Hash hash) {

    public Address {
        Objects.requireNonNull(hash, "hash");
    }

    public static Address fromPublicKey(PublicKey publicKey) {
        Objects.requireNonNull(publicKey, "publicKey");
        return new Address(Hash.compute(publicKey.getEncoded()));
    }

    /**
     * The thread this address belongs to: the top {@code log2(threadCount)}
     * bits of the address hash.
     *
     * @param threadCount a power of two between 1 and 128
     */
    public int thread(int threadCount) {
        if (threadCount < 1 || threadCount > 128 || Integer.bitCount(threadCount) != 1) {
            throw new IllegalArgumentException("threadCount must be a power of two in [1, 128]: " + threadCount);
        }
        int bits = Integer.numberOfTrailingZeros(threadCount);
        if (bits == 0) {
            return 0;
        }
        return hash.leadingByte() >> (8 - bits);
    }

    @Override
    public String toString() {
        return "A:" + hash.toString().substring(0, 12);
    }
}
