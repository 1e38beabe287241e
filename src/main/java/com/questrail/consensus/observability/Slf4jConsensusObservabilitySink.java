package com.questrail.consensus.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ConsensusObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jConsensusObservabilitySink implements ConsensusObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jConsensusObservabilitySink.class);

    @Override
    public void onBlockIntegrated(BlockIntegratedEvent event) {
        log.debug("Block {} integrated at slot {}{}",
            event.blockId(),
            event.slot(),
            event.fromWaitingList() ? " (dependencies resolved)" : "");
    }

    @Override
    public void onBlockDiscarded(BlockDiscardedEvent event) {
        log.info("Block {} discarded: {}", event.blockId(), event.reason());
    }

    @Override
    public void onError(ConsensusErrorEvent event) {
        log.error("Consensus error: {}", event.message(), event.cause());
    }
}
