package com.questrail.consensus.model;

import java.util.Objects;

public record EndorsementId(Hash hash) implements ContentId {
    public EndorsementId {
        Objects.requireNonNull(hash, "hash");
    }
}
