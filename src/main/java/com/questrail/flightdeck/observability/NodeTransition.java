package com.questrail.flightdeck.observability;

import com.questrail.flightdeck.api.NodeId;
import com.questrail.flightdeck.api.NodeKind;
import com.questrail.flightdeck.api.Status;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing one node status change.
 */
public record NodeTransition(
    String runId,
    long sequence,
    NodeId nodeId,
    NodeKind kind,
    Status from,
    Status to,
    Instant timestamp
) implements ProgressEvent {
    public NodeTransition {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    /**
     * Checks if this transition finalized the node.
     */
    public boolean isFinalization() {
        return to.isTerminal();
    }
}
