package com.questrail.flightdeck.tree;

import com.questrail.flightdeck.api.NodeId;
import com.questrail.flightdeck.api.NodeKind;
import com.questrail.flightdeck.api.Status;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A node was finalized before all of its children, or a finalized node was
 * mutated. This is an engine defect and is fatal to the run.
 */
public final class AggregationInvariantViolationException extends RuntimeException
{
    /**
     * State of the offending node when the violation was detected.
     */
    public record NodeSnapshot(NodeId id,
                               NodeKind kind,
                               Status status,
                               Optional<Result> result,
                               List<NodeId> unfinishedChildren)
    {
        public NodeSnapshot {
            Objects.requireNonNull(id, "id");
            unfinishedChildren = List.copyOf(unfinishedChildren);
        }

        static NodeSnapshot of(Testable node) {
            List<NodeId> unfinished = node.children().stream()
                    .filter(c -> !c.isFinalized())
                    .map(Testable::id)
                    .toList();
            return new NodeSnapshot(node.id(), node.kind(), node.status(), node.result(), unfinished);
        }

        @Override
        public String toString() {
            return kind + " " + id + " status=" + status
                    + " result=" + result.map(Result::toString).orElse("none")
                    + " unfinished=" + unfinishedChildren;
        }
    }

    private final transient NodeSnapshot snapshot;

    public AggregationInvariantViolationException(String message, NodeSnapshot snapshot) {
        super(message + " [" + snapshot + "]");
        this.snapshot = snapshot;
    }

    public NodeSnapshot snapshot() {
        return snapshot;
    }
}
