package com.questrail.consensus.model;

import java.util.Objects;

/**
 * Content-derived block identifier.
 */
public record BlockId(Hash hash) implements ContentId {
    public BlockId {
        Objects.requireNonNull(hash, "hash");
    }

    @Override
    public String toString() {
        return "B:" + hash.toString().substring(0, 12);
    }
}
