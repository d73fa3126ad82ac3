package com.questrail.flightdeck.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for observability: result start/end
 * timestamps and progress event timestamps.
 *
 * <p>
 * This clock may jump due to DST, NTP adjustments, or explicit time setting.
 * It MUST NOT be used for step deadlines.
 * </p>
 */
public interface WallClock
{
    Instant now();
}
