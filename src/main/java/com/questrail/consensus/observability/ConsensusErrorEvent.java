package com.questrail.consensus.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly inside the engine.
 */
public record ConsensusErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
