package com.questrail.consensus.test.harness;

import com.questrail.consensus.channel.ChannelClosedException;
import com.questrail.consensus.channel.CommandChannel;
import com.questrail.consensus.channel.CommandSender;
import com.questrail.consensus.channel.TimedReceiver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * AbstractMockController
 * =============================================================================
 * Test double standing in for one engine collaborator.
 *
 * <p>A controller owns the receive end of the channel the engine sends its
 * commands to. Subclasses add the stimuli their role can inject.</p>
 *
 * <h2>Observation</h2>
 * <ul>
 *   <li>{@link #waitCommand} reads commands until one matches; see
 *       {@link CommandWaiter}.</li>
 *   <li>{@link #ignoreCommandsWhile} discards every command while an
 *       operation, typically the engine's stop, runs to completion.</li>
 * </ul>
 *
 * @param <C> command type received from the engine
 */
public abstract class AbstractMockController<C>
{
    private static final Logger log = LoggerFactory.getLogger(AbstractMockController.class);

    private final String role;
    private final CommandChannel<C> commands;
    private final HarnessSettings settings;
    private final CommandWaiter<C> waiter;

    protected AbstractMockController(String role, HarnessSettings settings) {
        this.role = Objects.requireNonNull(role, "role");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.commands = new CommandChannel<>(role + "-commands", settings.channelCapacity());
        this.waiter = new CommandWaiter<>(commands);
    }

    public final String role() {
        return role;
    }

    /**
     * Send side handed to the engine.
     */
    public final CommandSender<C> commandSender() {
        return commands;
    }

    final TimedReceiver<C> commandReceiver() {
        return commands;
    }

    final HarnessSettings settings() {
        return settings;
    }

    /**
     * Waits for the next command the predicate projects.
     *
     * @return the projection, or empty if nothing matched within {@code timeout}
     */
    public final <R> Optional<R> waitCommand(Duration timeout, Function<? super C, Optional<R>> predicate) {
        return waiter.waitCommand(timeout, predicate);
    }

    /**
     * Discards commands arriving on this controller's channel until
     * {@code operation} completes, then absorbs whatever is still queued.
     *
     * <p>The drain runs on its own thread; the calling thread waits for the
     * operation, at most {@link HarnessSettings#shutdownTimeout()}.</p>
     *
     * @return the operation's result
     * @throws HarnessException if the operation fails or does not complete in
     *         time, or the channel closes under the drain
     */
    public final <T> T ignoreCommandsWhile(CompletionStage<T> operation) {
        Objects.requireNonNull(operation, "operation");
        CompletableFuture<T> future = operation.toCompletableFuture();

        CancellationToken done = new CancellationToken();
        DrainLoop drain = new DrainLoop(role + "-ignore", commands, done, settings.sinkPoll()).start();

        T result = null;
        HarnessException failure = null;
        try {
            result = future.get(settings.shutdownTimeout().toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            failure = new HarnessException(HarnessStage.STOPPING,
                    role + ": operation did not complete within " + settings.shutdownTimeout(), e);
        } catch (ExecutionException e) {
            failure = new HarnessException(HarnessStage.STOPPING,
                    role + ": operation failed while ignoring commands", e.getCause());
        } catch (CancellationException e) {
            failure = new HarnessException(HarnessStage.STOPPING, role + ": operation was cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = new HarnessException(HarnessStage.STOPPING,
                    role + ": interrupted while ignoring commands", e);
        }

        done.cancel();
        if (!drain.join(settings.shutdownTimeout())) {
            log.warn("{}: drain thread {} did not exit", role, drain.threadName());
        }
        int leftovers = discardPending();
        log.debug("{}: ignored {} command(s) during operation, {} after", role, drain.discarded(), leftovers);

        if (drain.failure() != null) {
            HarnessException channelFailure = new HarnessException(HarnessStage.STOPPING,
                    role + ": channel failed while ignoring commands", drain.failure());
            if (failure == null) {
                failure = channelFailure;
            } else {
                failure.addSuppressed(channelFailure);
            }
        }
        if (failure != null) {
            throw failure;
        }
        return result;
    }

    /**
     * Discards every command already queued, without waiting.
     *
     * @return the number of commands discarded
     */
    public final int discardPending() {
        int discarded = 0;
        try {
            while (commands.tryReceive().isPresent()) {
                discarded++;
            }
        } catch (ChannelClosedException e) {
            log.trace("{}: channel closed while discarding", role);
        }
        return discarded;
    }

    /**
     * Closes the controller's channels. Engine threads still sending then
     * fail instead of blocking.
     */
    public void close() {
        commands.close();
    }
}
