package com.questrail.flightdeck.tree;

import com.questrail.flightdeck.api.ActionOutcome;
import com.questrail.flightdeck.api.Status;
import com.questrail.flightdeck.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ResultAggregator
 * =============================================================================
 * The only component allowed to change a node's status or result.
 *
 * <h2>Transitions</h2>
 * <pre>
 *   PENDING → RUNNING                 start(node)
 *   RUNNING → PASSED|FAILED|...       finalizeStep / finalizeContainer
 *   PENDING → SKIPPED                 skip(node)   (never started)
 * </pre>
 * Every transition is reported to the {@link TransitionListener} after it has
 * been applied, on the calling thread.
 *
 * <h2>Propagation</h2>
 * Finalizing a node delivers its result to the parent exactly once. A container
 * may only be finalized after it has received a result from every child; its
 * status is then {@link Aggregation#reduce} over the children, and its message
 * is taken from the first child (declaration order) holding that status.
 *
 * <h2>Invariants</h2>
 * Finalizing a container early, starting a node twice or delivering a child
 * result twice raises {@link AggregationInvariantViolationException}.
 * Re-finalizing a finalized node is a logged no-op, or a violation in strict
 * mode; it never changes the existing result.
 *
 * <h2>Thread Safety</h2>
 * Each node's state is guarded by its own cell monitor. Concurrent siblings may
 * finalize at the same time; their deliveries to the shared parent are
 * serialized.
 */
public final class ResultAggregator
{
    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    private final WallClock wallClock;
    private final TransitionListener listener;
    private final boolean strict;

    public ResultAggregator(WallClock wallClock, TransitionListener listener, boolean strict) {
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.strict = strict;
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * Moves a pending node to {@code RUNNING}.
     *
     * @return {@code false} if the node was already finalized (non-strict mode)
     */
    public boolean start(Testable node) {
        NodeCell cell = NodeCell.of(node);
        Instant at;
        synchronized (cell) {
            if (cell.result != null) {
                return rejectFinalized(node, "start");
            }
            if (cell.status != Status.PENDING) {
                throw new AggregationInvariantViolationException("Node started twice",
                        AggregationInvariantViolationException.NodeSnapshot.of(node));
            }
            at = wallClock.now();
            cell.startedAt = at;
            cell.status = Status.RUNNING;
        }
        listener.onTransition(node, Status.PENDING, Status.RUNNING, at);
        return true;
    }

    /**
     * Finalizes a step with a terminal status.
     *
     * @return the step's result; the existing one if it was already finalized
     */
    public Result finalizeStep(Step step, Status status, String message,
                               ActionOutcome outcome, Throwable failure)
    {
        Objects.requireNonNull(status, "status");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("cannot finalize with non-terminal status " + status);
        }
        NodeCell cell = NodeCell.of(step);
        Status from;
        Result result;
        synchronized (cell) {
            if (cell.result != null) {
                rejectFinalized(step, "finalize");
                return cell.result;
            }
            Instant now = wallClock.now();
            Instant started = cell.startedAt != null ? cell.startedAt : now;
            result = new Result(step, status, started, now, message, outcome, failure);
            from = cell.status;
            cell.result = result;
            cell.status = status;
        }
        announce(step, from, result);
        return result;
    }

    /**
     * Finalizes a container from its children's results.
     */
    public Result finalizeContainer(Testable container) {
        return finalizeContainer(container, null, null, null);
    }

    /**
     * Finalizes a container from its children's results, optionally raised to
     * at least {@code floor} (e.g. {@code ERROR} after a failed lifecycle phase).
     * When the floor dominates, {@code message} and {@code failure} describe the
     * result; otherwise the first dominant child's message is used.
     *
     * @return the container's result; the existing one if it was already finalized
     */
    public Result finalizeContainer(Testable container, Status floor, String message, Throwable failure) {
        if (container instanceof Step) {
            throw new IllegalArgumentException("not a container: " + container.id());
        }
        if (floor != null && !floor.isTerminal()) {
            throw new IllegalArgumentException("floor must be terminal: " + floor);
        }
        NodeCell cell = NodeCell.of(container);
        Status from;
        Result result;
        synchronized (cell) {
            if (cell.result != null) {
                rejectFinalized(container, "finalize");
                return cell.result;
            }
            List<Result> children = new ArrayList<>();
            for (Testable child : container.children()) {
                Optional<Result> r = child.result();
                if (r.isEmpty() || !cell.hasReceived(child.id())) {
                    throw new AggregationInvariantViolationException(
                            "Container finalized before child " + child.id() + " finalized",
                            AggregationInvariantViolationException.NodeSnapshot.of(container));
                }
                children.add(r.get());
            }

            Status aggregate = Aggregation.reduce(children.stream().map(Result::status).toList());
            Status status = aggregate;
            String text;
            Throwable cause = null;
            if (floor != null && floor.precedence() >= aggregate.precedence()) {
                status = floor;
                text = message;
                cause = failure;
            } else {
                text = Aggregation.firstDominant(children).map(Result::message).orElse("");
            }

            Instant now = wallClock.now();
            Instant started = cell.startedAt != null ? cell.startedAt : now;
            result = new Result(container, status, started, now, text, null, cause);
            from = cell.status;
            cell.result = result;
            cell.status = status;
        }
        announce(container, from, result);
        return result;
    }

    /**
     * Finalizes every not-yet-finalized node of a subtree, leaves first.
     * Steps and never-started containers become {@code SKIPPED}; a container
     * already running is finalized from its children as usual.
     *
     * @throws AggregationInvariantViolationException if a step in the subtree is running
     */
    public void skip(Testable node, String reason) {
        if (node.isFinalized()) {
            return;
        }
        for (Testable child : node.children()) {
            skip(child, reason);
        }
        NodeCell cell = NodeCell.of(node);
        if (node instanceof Step step) {
            if (cell.status == Status.RUNNING) {
                throw new AggregationInvariantViolationException("Cannot skip a running step",
                        AggregationInvariantViolationException.NodeSnapshot.of(node));
            }
            finalizeStep(step, Status.SKIPPED, reason, null, null);
        } else if (cell.status == Status.PENDING) {
            finalizeContainer(node, Status.SKIPPED, reason, null);
        } else {
            finalizeContainer(node);
        }
    }

    /**
     * Live view of a container's status from the children finalized so far.
     * Not a final status: more children may still arrive.
     */
    public Status provisionalStatus(Testable container) {
        NodeCell cell = NodeCell.of(container);
        Result finalResult = cell.result;
        if (finalResult != null) {
            return finalResult.status();
        }
        List<Result> received = cell.receivedInArrivalOrder();
        if (received.isEmpty()) {
            return cell.status;
        }
        return Aggregation.reduce(received.stream().map(Result::status).toList());
    }

    private void announce(Testable node, Status from, Result result) {
        listener.onTransition(node, from, result.status(), result.endedAt());
        Optional<Testable> parent = node.parent();
        if (parent.isPresent()) {
            if (!NodeCell.of(parent.get()).receive(node.id(), result)) {
                throw new AggregationInvariantViolationException("Child result delivered twice",
                        AggregationInvariantViolationException.NodeSnapshot.of(node));
            }
        }
    }

    private boolean rejectFinalized(Testable node, String operation) {
        if (strict) {
            throw new AggregationInvariantViolationException("Cannot " + operation + " a finalized node",
                    AggregationInvariantViolationException.NodeSnapshot.of(node));
        }
        log.warn("Ignoring {} of finalized {} {} ({})", operation, node.kind(), node.id(), node.status());
        return false;
    }
}
