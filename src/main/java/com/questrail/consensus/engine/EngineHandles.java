package com.questrail.consensus.engine;

import java.util.Objects;

/**
 * What a started engine hands back to its owner.
 */
public record EngineHandles(ConsensusCommandSender commandSender,
                            ConsensusEventReceiver eventReceiver,
                            ConsensusManager manager) {
    public EngineHandles {
        Objects.requireNonNull(commandSender, "commandSender");
        Objects.requireNonNull(eventReceiver, "eventReceiver");
        Objects.requireNonNull(manager, "manager");
    }
}
