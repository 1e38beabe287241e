package com.questrail.consensus.engine;

import com.questrail.consensus.channel.CommandSender;
import com.questrail.consensus.channel.TimedReceiver;
import com.questrail.consensus.engine.execution.ExecutionController;
import com.questrail.consensus.engine.pool.PoolCommand;
import com.questrail.consensus.engine.protocol.ProtocolCommand;
import com.questrail.consensus.engine.protocol.ProtocolEvent;

import java.util.Objects;

/**
 * The collaborator endpoints an engine is wired to.
 */
public record ConsensusChannels(ExecutionController executionController,
                                CommandSender<ProtocolCommand> protocolCommandSender,
                                TimedReceiver<ProtocolEvent> protocolEventReceiver,
                                CommandSender<PoolCommand> poolCommandSender) {
    public ConsensusChannels {
        Objects.requireNonNull(executionController, "executionController");
        Objects.requireNonNull(protocolCommandSender, "protocolCommandSender");
        Objects.requireNonNull(protocolEventReceiver, "protocolEventReceiver");
        Objects.requireNonNull(poolCommandSender, "poolCommandSender");
    }
}
