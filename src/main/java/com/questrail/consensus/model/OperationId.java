package com.questrail.consensus.model;

import java.util.Objects;

public record OperationId(Hash hash) implements ContentId {
    public OperationId {
        Objects.requireNonNull(hash, "hash");
    }
}
