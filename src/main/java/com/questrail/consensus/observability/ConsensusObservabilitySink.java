package com.questrail.consensus.observability;

/**
 * Receives engine observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface ConsensusObservabilitySink {
    /**
     * Called when a block is integrated into the active graph.
     * @param event the integration details
     */
    void onBlockIntegrated(BlockIntegratedEvent event);

    /**
     * Called when a received block is dropped.
     * @param event the block and the reason
     */
    void onBlockDiscarded(BlockDiscardedEvent event);

    /**
     * Called when an error or anomaly occurs in the engine.
     * @param event the error event
     */
    void onError(ConsensusErrorEvent event);
}
