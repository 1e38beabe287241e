package com.questrail.consensus.internal.worker;

import com.questrail.consensus.channel.ChannelClosedException;
import com.questrail.consensus.channel.CommandChannel;
import com.questrail.consensus.engine.BlockStorage;
import com.questrail.consensus.engine.ConsensusChannels;
import com.questrail.consensus.engine.ConsensusCommand;
import com.questrail.consensus.engine.ConsensusEvent;
import com.questrail.consensus.engine.ConsensusEventReceiver;
import com.questrail.consensus.engine.ConsensusManager;
import com.questrail.consensus.engine.ExportActiveBlock;
import com.questrail.consensus.engine.ExportProofOfStake;
import com.questrail.consensus.engine.pool.PoolCommand;
import com.questrail.consensus.engine.protocol.ProtocolCommand;
import com.questrail.consensus.engine.protocol.ProtocolEvent;
import com.questrail.consensus.internal.time.WallClock;
import com.questrail.consensus.model.Address;
import com.questrail.consensus.model.Block;
import com.questrail.consensus.model.BlockId;
import com.questrail.consensus.model.Slot;
import com.questrail.consensus.model.Wrapped;
import com.questrail.consensus.observability.BlockDiscardedEvent;
import com.questrail.consensus.observability.BlockIntegratedEvent;
import com.questrail.consensus.observability.ConsensusErrorEvent;
import com.questrail.consensus.observability.ConsensusObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * WorkerLoop
 * =============================================================================
 * Serialized event loop of the reference consensus worker.
 *
 * <h2>Threading Model</h2>
 * A single thread owns the {@link BlockGraphState}. It interleaves three
 * sources, in this order on every turn:
 * <ol>
 *   <li>slot ticks queued by the {@link SlotTicker}</li>
 *   <li>queries from the engine's command channel</li>
 *   <li>protocol events, waited for up to {@link #INBOUND_POLL}</li>
 * </ol>
 * Every input goes through {@link BlockGraphReducer}; the loop then performs
 * the resulting effects. Queries read the state directly.
 *
 * <h2>Failure</h2>
 * A collaborator channel closing under the worker ends the loop. The failure
 * is reported to the observability sink and completes the stop future
 * exceptionally.
 */
final class WorkerLoop implements ConsensusManager
{
    private static final Logger log = LoggerFactory.getLogger(WorkerLoop.class);

    static final Duration INBOUND_POLL = Duration.ofMillis(10);

    private final BlockGraphReducer reducer;
    private final ConsensusChannels channels;
    private final CommandChannel<ConsensusCommand> commands;
    private final CommandChannel<ConsensusEvent> events;
    private final BlockStorage storage;
    private final ExportProofOfStake bootPos;
    private final Set<Address> stakingAddresses;
    private final ConsensusObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final BlockingQueue<WorkerInput> ticks = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<Throwable> failure = new AtomicReference<>();

    private volatile BlockGraphState state;
    private volatile Thread eventLoopThread;
    private SlotTicker ticker;
    private ExecutorService tickerExecutor;
    private CompletableFuture<Void> stopFuture;

    WorkerLoop(BlockGraphReducer reducer,
               BlockGraphState initialState,
               ConsensusChannels channels,
               CommandChannel<ConsensusCommand> commands,
               CommandChannel<ConsensusEvent> events,
               BlockStorage storage,
               ExportProofOfStake bootPos,
               Set<Address> stakingAddresses,
               ConsensusObservabilitySink observabilitySink,
               WallClock wallClock) {
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.state = Objects.requireNonNull(initialState, "initialState");
        this.channels = Objects.requireNonNull(channels, "channels");
        this.commands = Objects.requireNonNull(commands, "commands");
        this.events = Objects.requireNonNull(events, "events");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.bootPos = bootPos;
        this.stakingAddresses = Set.copyOf(stakingAddresses);
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Starts the event loop thread. Idempotent.
     */
    void start() {
        if (running.compareAndSet(false, true)) {
            eventLoopThread = new Thread(this::runEventLoop, "consensus-worker");
            eventLoopThread.setDaemon(true);
            eventLoopThread.start();
        }
    }

    /**
     * Attaches the slot ticker; it is cancelled, and its executor shut down,
     * when the worker stops.
     */
    void attachTicker(SlotTicker ticker, ExecutorService tickerExecutor) {
        this.ticker = ticker;
        this.tickerExecutor = tickerExecutor;
    }

    /**
     * Queues a slot tick. Callable from any thread.
     */
    void submitTick(Slot slot) {
        if (running.get()) {
            ticks.offer(new WorkerInput.SlotTick(slot));
        }
    }

    BlockGraphState currentState() {
        return state;
    }

    @Override
    public synchronized CompletableFuture<Void> stop(ConsensusEventReceiver eventReceiver) {
        Objects.requireNonNull(eventReceiver, "eventReceiver");
        if (stopFuture != null) {
            return stopFuture;
        }
        CompletableFuture<Void> future = new CompletableFuture<>();
        stopFuture = future;

        Thread stopper = new Thread(() -> {
            try {
                shutdown(eventReceiver);
                future.complete(null);
            } catch (Throwable t) {
                future.completeExceptionally(t);
            }
        }, "consensus-worker-stop");
        stopper.setDaemon(true);
        stopper.start();
        return future;
    }

    private void shutdown(ConsensusEventReceiver eventReceiver) throws InterruptedException {
        if (ticker != null) {
            ticker.cancel();
        }
        if (tickerExecutor != null) {
            tickerExecutor.shutdownNow();
        }

        running.set(false);
        Thread loop = eventLoopThread;
        if (loop != null) {
            // Outbound channels are drained by the owner until this completes.
            loop.join();
        }

        commands.close();
        failPendingQueries();
        int discarded = eventReceiver.drain();
        events.close();
        log.info("Consensus worker stopped ({} pending event(s) discarded)", discarded);

        Throwable cause = failure.get();
        if (cause != null) {
            throw new CompletionException("consensus worker failed", cause);
        }
    }

    // ---------------------------------------------------------------------
    // Event loop
    // ---------------------------------------------------------------------

    private void runEventLoop() {
        try {
            while (running.get()) {
                WorkerInput tick;
                while ((tick = ticks.poll()) != null) {
                    process(tick);
                }

                Optional<ConsensusCommand> query;
                while ((query = commands.tryReceive()).isPresent()) {
                    answer(query.get());
                }

                Optional<ProtocolEvent> inbound = channels.protocolEventReceiver().receive(INBOUND_POLL);
                if (inbound.isPresent()) {
                    process(new WorkerInput.Inbound(inbound.get()));
                }
            }
        } catch (ChannelClosedException e) {
            failure.compareAndSet(null, e);
            observabilitySink.onError(new ConsensusErrorEvent(
                    wallClock.now(),
                    "Collaborator channel closed; worker loop ended",
                    e));
        }
    }

    private void process(WorkerInput input) {
        final BlockGraphReducer.Result result;
        try {
            result = reducer.apply(state, input);
        } catch (RuntimeException e) {
            observabilitySink.onError(new ConsensusErrorEvent(
                    wallClock.now(),
                    "Input processing error: " + input,
                    e));
            return;
        }
        state = result.newState();
        perform(result.effects());
    }

    private void perform(WorkerEffects effects) {
        for (Wrapped<Block, BlockId> block : effects.blocksToStore()) {
            storage.storeBlock(block);
        }
        for (WorkerEffects.Integrated i : effects.integrated()) {
            observabilitySink.onBlockIntegrated(new BlockIntegratedEvent(
                    wallClock.now(), i.blockId(), i.slot(), i.fromWaitingList()));
        }
        for (WorkerEffects.Discarded d : effects.discarded()) {
            observabilitySink.onBlockDiscarded(new BlockDiscardedEvent(
                    wallClock.now(), d.blockId(), d.reason()));
        }
        for (ProtocolCommand command : effects.protocolCommands()) {
            channels.protocolCommandSender().send(command);
        }
        for (PoolCommand command : effects.poolCommands()) {
            channels.poolCommandSender().send(command);
        }
        for (WorkerEffects.ExecutionUpdate update : effects.executionUpdates()) {
            channels.executionController().updateBlockcliqueStatus(
                    update.finalizedBlocks(), update.blockclique());
        }
        for (ConsensusEvent event : effects.consensusEvents()) {
            if (!events.trySend(event)) {
                log.warn("Consensus event channel full, dropping {}", event);
            }
        }
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    private void answer(ConsensusCommand query) {
        BlockGraphState s = state;
        if (query instanceof ConsensusCommand.GetBlockGraphStatus q) {
            q.reply().complete(s.export());
        } else if (query instanceof ConsensusCommand.GetActiveBlock q) {
            ExportActiveBlock active = s.activeBlocks().get(q.blockId());
            q.reply().complete(active == null ? Optional.empty() : Optional.of(active.block()));
        } else if (query instanceof ConsensusCommand.GetStakingAddresses q) {
            q.reply().complete(stakingAddresses);
        } else if (query instanceof ConsensusCommand.GetStakers q) {
            q.reply().complete(bootPos == null ? Map.of() : bootPos.rollCounts());
        }
    }

    private void failPendingQueries() {
        try {
            Optional<ConsensusCommand> query;
            while ((query = commands.tryReceive()).isPresent()) {
                query.get().reply().completeExceptionally(
                        new IllegalStateException("consensus worker stopped"));
            }
        } catch (ChannelClosedException e) {
            log.trace("Command channel drained");
        }
    }
}
