package com.questrail.flightdeck.observability;

import com.questrail.flightdeck.api.Status;
import com.questrail.flightdeck.tree.ResultTree;

import java.time.Instant;
import java.util.Objects;

/**
 * Terminal event of a run, carrying the aggregated result tree.
 */
public record RunCompleted(
    String runId,
    long sequence,
    ResultTree tree,
    Instant timestamp
) implements ProgressEvent {
    public RunCompleted {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public Status status() {
        return tree.status();
    }
}
