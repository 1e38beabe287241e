package com.questrail.consensus.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for observability timestamps.
 *
 * <p>This clock may jump. It MUST NOT be used for timeouts, slot ticks or
 * polling; those use {@link MonotonicClock}.</p>
 */
public interface WallClock
{
    Instant now();
}
