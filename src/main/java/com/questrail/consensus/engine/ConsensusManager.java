package com.questrail.consensus.engine;

import java.util.concurrent.CompletableFuture;

/**
 * Handle used only to stop a running engine.
 */
public interface ConsensusManager
{
    /**
     * Begins the engine's stop sequence.
     *
     * <p>Idempotent within one run: repeated calls return the same future. The
     * engine may keep emitting commands until the future completes, so callers
     * must keep its outbound channels drained meanwhile.</p>
     *
     * @param eventReceiver the receiver returned at start, drained during stop
     */
    CompletableFuture<Void> stop(ConsensusEventReceiver eventReceiver);
}
