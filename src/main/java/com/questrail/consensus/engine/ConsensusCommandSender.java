package com.questrail.consensus.engine;

import com.questrail.consensus.channel.ChannelClosedException;
import com.questrail.consensus.channel.CommandSender;
import com.questrail.consensus.model.Address;
import com.questrail.consensus.model.Block;
import com.questrail.consensus.model.BlockId;
import com.questrail.consensus.model.Wrapped;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Typed front for querying a running engine.
 *
 * <p>Every query returns a future; if the engine is gone the future completes
 * exceptionally with {@link ChannelClosedException}.</p>
 */
public final class ConsensusCommandSender
{
    private final CommandSender<ConsensusCommand> sender;

    public ConsensusCommandSender(CommandSender<ConsensusCommand> sender) {
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    public CompletableFuture<BlockGraphExport> getBlockGraphStatus() {
        CompletableFuture<BlockGraphExport> reply = new CompletableFuture<>();
        return submit(new ConsensusCommand.GetBlockGraphStatus(reply), reply);
    }

    public CompletableFuture<Optional<Wrapped<Block, BlockId>>> getActiveBlock(BlockId blockId) {
        CompletableFuture<Optional<Wrapped<Block, BlockId>>> reply = new CompletableFuture<>();
        return submit(new ConsensusCommand.GetActiveBlock(blockId, reply), reply);
    }

    public CompletableFuture<Set<Address>> getStakingAddresses() {
        CompletableFuture<Set<Address>> reply = new CompletableFuture<>();
        return submit(new ConsensusCommand.GetStakingAddresses(reply), reply);
    }

    public CompletableFuture<Map<Address, Long>> getStakers() {
        CompletableFuture<Map<Address, Long>> reply = new CompletableFuture<>();
        return submit(new ConsensusCommand.GetStakers(reply), reply);
    }

    private <R> CompletableFuture<R> submit(ConsensusCommand command, CompletableFuture<R> reply) {
        try {
            sender.send(command);
        } catch (ChannelClosedException e) {
            reply.completeExceptionally(e);
        }
        return reply;
    }
}
