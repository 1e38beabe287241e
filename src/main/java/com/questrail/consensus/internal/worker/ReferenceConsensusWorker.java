package com.questrail.consensus.internal.worker;

import com.questrail.consensus.channel.CommandChannel;
import com.questrail.consensus.engine.BlockStorage;
import com.questrail.consensus.engine.BootstrapableGraph;
import com.questrail.consensus.engine.ConsensusChannels;
import com.questrail.consensus.engine.ConsensusCommand;
import com.questrail.consensus.engine.ConsensusCommandSender;
import com.questrail.consensus.engine.ConsensusConfig;
import com.questrail.consensus.engine.ConsensusEngine;
import com.questrail.consensus.engine.ConsensusEvent;
import com.questrail.consensus.engine.ConsensusEventReceiver;
import com.questrail.consensus.engine.ConsensusStartException;
import com.questrail.consensus.engine.EngineHandles;
import com.questrail.consensus.engine.ExportActiveBlock;
import com.questrail.consensus.engine.ExportProofOfStake;
import com.questrail.consensus.internal.time.MonotonicClock;
import com.questrail.consensus.internal.time.ScheduledExecutorScheduler;
import com.questrail.consensus.internal.time.SystemMonotonicClock;
import com.questrail.consensus.internal.time.SystemWallClock;
import com.questrail.consensus.internal.time.WallClock;
import com.questrail.consensus.model.Address;
import com.questrail.consensus.model.Block;
import com.questrail.consensus.model.BlockHeader;
import com.questrail.consensus.model.BlockId;
import com.questrail.consensus.model.Hash;
import com.questrail.consensus.model.Slot;
import com.questrail.consensus.model.Wrapped;
import com.questrail.consensus.observability.ConsensusObservabilitySink;
import com.questrail.consensus.observability.NullObservabilitySink;
import com.questrail.consensus.observability.Slf4jConsensusObservabilitySink;
import com.questrail.consensus.signing.ContentSigner;
import com.questrail.consensus.signing.Ed25519ContentSigner;
import com.questrail.consensus.signing.KeyPairs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.KeyPair;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * ReferenceConsensusWorker
 * =============================================================================
 * In-process {@link ConsensusEngine} used to exercise the test harness.
 *
 * <p>The worker keeps a block graph, integrates blocks whose parents it knows,
 * asks the protocol for those it does not, and advances a slot clock that it
 * reports to the pool. The rules live in {@link BlockGraphReducer}; threading
 * lives in {@link WorkerLoop}.</p>
 *
 * <h2>Startup</h2>
 * <ul>
 *   <li>With a non-empty bootstrap graph, the graph is restored as is.</li>
 *   <li>Otherwise one genesis block per thread is created at slot
 *       {@code (0, thread)}, signed by a throwaway key.</li>
 *   <li>Every active block is written to the shared storage.</li>
 *   <li>Nothing is sent to the protocol at startup.</li>
 * </ul>
 */
public final class ReferenceConsensusWorker implements ConsensusEngine
{
    private static final Logger log = LoggerFactory.getLogger(ReferenceConsensusWorker.class);

    private final ContentSigner signer;
    private final ConsensusObservabilitySink observabilitySink;
    private final MonotonicClock clock;
    private final WallClock wallClock;

    public ReferenceConsensusWorker() {
        this(Ed25519ContentSigner.INSTANCE, new Slf4jConsensusObservabilitySink());
    }

    public ReferenceConsensusWorker(ContentSigner signer, ConsensusObservabilitySink observabilitySink) {
        this(signer, observabilitySink, SystemMonotonicClock.INSTANCE, SystemWallClock.INSTANCE);
    }

    public ReferenceConsensusWorker(ContentSigner signer,
                                    ConsensusObservabilitySink observabilitySink,
                                    MonotonicClock clock,
                                    WallClock wallClock) {
        this.signer = Objects.requireNonNull(signer, "signer");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public EngineHandles start(ConsensusConfig config,
                               ConsensusChannels channels,
                               ExportProofOfStake bootPos,
                               BootstrapableGraph bootGraph,
                               BlockStorage storage,
                               Slot startSlot,
                               String password,
                               Map<Address, KeyPair> stakingKeys) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(channels, "channels");
        Objects.requireNonNull(storage, "storage");
        Objects.requireNonNull(startSlot, "startSlot");
        Objects.requireNonNull(password, "password");
        Objects.requireNonNull(stakingKeys, "stakingKeys");
        if (startSlot.thread() >= config.threadCount()) {
            throw new ConsensusStartException("start slot " + startSlot + " is outside "
                    + config.threadCount() + " thread(s)");
        }

        BlockGraphState initial = (bootGraph != null && !bootGraph.isEmpty())
                ? BlockGraphState.fromBootstrap(bootGraph, config.threadCount(), startSlot)
                : BlockGraphState.genesis(createGenesisBlocks(config.threadCount()), startSlot);
        for (ExportActiveBlock active : initial.activeBlocks().values()) {
            storage.storeBlock(active.block());
        }

        CommandChannel<ConsensusCommand> commands =
                new CommandChannel<>("consensus-commands", config.channelCapacity());
        CommandChannel<ConsensusEvent> events =
                new CommandChannel<>("consensus-events", config.channelCapacity());

        BlockGraphReducer reducer = new BlockGraphReducer(config, signer, storage::retrieveBlock);
        WorkerLoop loop = new WorkerLoop(reducer, initial, channels, commands, events, storage,
                bootPos, stakingKeys.keySet(), observabilitySink, wallClock);

        ScheduledExecutorService tickerExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "consensus-slot-ticker");
            t.setDaemon(true);
            return t;
        });
        SlotTicker ticker = new SlotTicker(new ScheduledExecutorScheduler(tickerExecutor, clock), clock,
                config.slotDuration(), config.threadCount(), startSlot, loop::submitTick);
        loop.attachTicker(ticker, tickerExecutor);

        loop.start();
        ticker.start();
        log.info("Consensus worker started at slot {} with {} active block(s) and {} staking key(s)",
                startSlot, initial.activeBlocks().size(), stakingKeys.size());

        return new EngineHandles(new ConsensusCommandSender(commands), new ConsensusEventReceiver(events), loop);
    }

    private List<Wrapped<Block, BlockId>> createGenesisBlocks(int threadCount) {
        KeyPair genesisKey = KeyPairs.generate();
        List<Wrapped<Block, BlockId>> genesis = new ArrayList<>();
        for (int thread = 0; thread < threadCount; thread++) {
            BlockHeader header = new BlockHeader(Slot.of(0, thread), List.of(),
                    Hash.compute(new byte[0]), List.of());
            Wrapped<BlockHeader, BlockId> wrappedHeader = signer.wrapHeader(header, genesisKey);
            genesis.add(signer.wrapBlock(new Block(wrappedHeader, List.of()), genesisKey));
        }
        return genesis;
    }
}
