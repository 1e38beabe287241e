package com.questrail.consensus.model;

import java.util.Objects;

public record Operation(long fee, long expirePeriod, OperationType type) {
    public Operation {
        Objects.requireNonNull(type, "type");
        if (fee < 0) {
            throw new IllegalArgumentException("fee must be >= 0");
        }
    }
}
