package com.questrail.flightdeck.observability;

import java.time.Instant;

/**
 * An entry of a run's ordered progress stream. Sequence numbers start at 1,
 * increase by one per event and are never reordered; {@link RunCompleted}
 * is always last.
 */
public sealed interface ProgressEvent permits NodeTransition, RunCompleted
{
    String runId();

    long sequence();

    Instant timestamp();
}
