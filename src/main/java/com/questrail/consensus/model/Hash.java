package com.questrail.consensus.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * 32-byte SHA-256 digest. Immutable; the backing array never escapes.
 */
public final class Hash
{
    public static final int LENGTH = 32;

    private static final String ALGORITHM = "SHA-256";

    private final byte[] bytes;

    private Hash(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Wraps an existing 32-byte digest.
     */
    public static Hash of(byte[] digest)
    {
        Objects.requireNonNull(digest, "digest");
        if (digest.length != LENGTH) {
            throw new IllegalArgumentException("digest must be " + LENGTH + " bytes, got " + digest.length);
        }
        return new Hash(digest.clone());
    }

    public static Hash compute(byte[] data)
    {
        Objects.requireNonNull(data, "data");
        try {
            return new Hash(MessageDigest.getInstance(ALGORITHM).digest(data));
        } catch (NoSuchAlgorithmException e) {
            // Every JDK ships SHA-256.
            throw new IllegalStateException(ALGORITHM + " unavailable", e);
        }
    }

    public static Hash compute(String text) {
        return compute(text.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    /**
     * First byte of the digest as an unsigned value.
     */
    int leadingByte() {
        return bytes[0] & 0xff;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Hash that)) return false;
        return Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return HexFormat.of().formatHex(bytes);
    }
}
