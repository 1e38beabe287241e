package com.questrail.consensus.observability;

/**
 * No-op implementation of ConsensusObservabilitySink.
 */
public final class NullObservabilitySink implements ConsensusObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onBlockIntegrated(BlockIntegratedEvent event) {}

    @Override
    public void onBlockDiscarded(BlockDiscardedEvent event) {}

    @Override
    public void onError(ConsensusErrorEvent event) {}
}
