package com.questrail.consensus.engine;

import com.questrail.consensus.model.Address;

import java.util.Map;

/**
 * Proof-of-stake snapshot an engine can be started from: roll counts per
 * staking address. The harness treats it as opaque.
 */
public record ExportProofOfStake(Map<Address, Long> rollCounts) {
    public ExportProofOfStake {
        rollCounts = Map.copyOf(rollCounts);
    }
}
