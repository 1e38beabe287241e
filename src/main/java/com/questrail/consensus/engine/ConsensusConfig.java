package com.questrail.consensus.engine;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * ConsensusConfig
 * -----------------------------------------------------------------------------
 * Operational configuration handed to a {@link ConsensusEngine} at start.
 *
 * <ul>
 *   <li><b>threadCount</b>: number of block threads; a power of two.</li>
 *   <li><b>t0</b>: period length. One slot lasts {@code t0 / threadCount}.</li>
 *   <li><b>finalityDepth</b>: how many periods later a block in the same
 *       thread must be integrated before a block becomes final.</li>
 *   <li><b>maxFuturePeriods</b>: blocks further than this many periods ahead
 *       of the current slot are not processed; the engine asks for a resync
 *       instead.</li>
 *   <li><b>stakingKeysPath</b>: encrypted staking key file; a missing file
 *       means no staking keys.</li>
 *   <li><b>channelCapacity</b>: capacity of the engine-owned event channel.</li>
 * </ul>
 */
public record ConsensusConfig(
        int threadCount,
        Duration t0,
        int finalityDepth,
        long maxFuturePeriods,
        Path stakingKeysPath,
        int channelCapacity
) {
    public ConsensusConfig {
        Objects.requireNonNull(t0, "t0");
        Objects.requireNonNull(stakingKeysPath, "stakingKeysPath");
        if (threadCount < 1 || threadCount > 128 || Integer.bitCount(threadCount) != 1) {
            throw new IllegalArgumentException("threadCount must be a power of two in [1, 128]");
        }
        if (t0.isNegative() || t0.isZero()) {
            throw new IllegalArgumentException("t0 must be positive");
        }
        if (finalityDepth < 1) {
            throw new IllegalArgumentException("finalityDepth must be >= 1");
        }
        if (maxFuturePeriods < 0) {
            throw new IllegalArgumentException("maxFuturePeriods must be >= 0");
        }
        if (channelCapacity < 1) {
            throw new IllegalArgumentException("channelCapacity must be >= 1");
        }
    }

    /**
     * Duration of one slot.
     */
    public Duration slotDuration() {
        return t0.dividedBy(threadCount);
    }

    /**
     * Defaults suited to tests: 2 threads, 1 s periods, finality after 3 periods.
     */
    public static ConsensusConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .withThreadCount(threadCount)
                .withT0(t0)
                .withFinalityDepth(finalityDepth)
                .withMaxFuturePeriods(maxFuturePeriods)
                .withStakingKeysPath(stakingKeysPath)
                .withChannelCapacity(channelCapacity);
    }

    public static final class Builder {
        private int threadCount = 2;
        private Duration t0 = Duration.ofMillis(1000);
        private int finalityDepth = 3;
        private long maxFuturePeriods = 100;
        private Path stakingKeysPath = Path.of("staking_keys.json");
        private int channelCapacity = 256;

        public Builder withThreadCount(int threadCount) {
            this.threadCount = threadCount;
            return this;
        }

        public Builder withT0(Duration t0) {
            this.t0 = t0;
            return this;
        }

        public Builder withFinalityDepth(int finalityDepth) {
            this.finalityDepth = finalityDepth;
            return this;
        }

        public Builder withMaxFuturePeriods(long maxFuturePeriods) {
            this.maxFuturePeriods = maxFuturePeriods;
            return this;
        }

        public Builder withStakingKeysPath(Path stakingKeysPath) {
            this.stakingKeysPath = stakingKeysPath;
            return this;
        }

        public Builder withChannelCapacity(int channelCapacity) {
            this.channelCapacity = channelCapacity;
            return this;
        }

        public ConsensusConfig build() {
            return new ConsensusConfig(threadCount, t0, finalityDepth, maxFuturePeriods,
                    stakingKeysPath, channelCapacity);
        }
    }
}
