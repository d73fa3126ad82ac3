package com.questrail.flightdeck.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly during a run: an aborted run, an
 * agent that failed to release, a subscriber fault. Not part of the ordered
 * transition stream.
 */
public record RunErrorEvent(
    String runId,
    Instant timestamp,
    String message,
    Throwable cause
) {
}
