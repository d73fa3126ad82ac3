package com.questrail.flightdeck.tree;

import com.questrail.flightdeck.api.ActionOutcome;
import com.questrail.flightdeck.api.NodeId;
import com.questrail.flightdeck.api.NodeKind;
import com.questrail.flightdeck.api.Status;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Result
 * -----------------------------------------------------------------------------
 * The immutable, finalized outcome of one {@link Testable}.
 *
 * <p>{@code startedAt} is the instant the node started running; for nodes that
 * were skipped without starting it equals {@code endedAt}. A step result may
 * carry the agent's raw {@link ActionOutcome}; an error result usually carries
 * the failure that caused it.</p>
 */
public final class Result
{
    private final Testable source;
    private final Status status;
    private final Instant startedAt;
    private final Instant endedAt;
    private final String message;
    private final ActionOutcome outcome;
    private final Throwable failure;

    Result(Testable source, Status status, Instant startedAt, Instant endedAt,
           String message, ActionOutcome outcome, Throwable failure)
    {
        this.source = Objects.requireNonNull(source, "source");
        this.status = Objects.requireNonNull(status, "status");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        this.endedAt = Objects.requireNonNull(endedAt, "endedAt");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("result status must be terminal: " + status);
        }
        this.message = message == null ? "" : message;
        this.outcome = outcome;
        this.failure = failure;
    }

    public Testable source() {
        return source;
    }

    public NodeId nodeId() {
        return source.id();
    }

    public NodeKind kind() {
        return source.kind();
    }

    public Status status() {
        return status;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant endedAt() {
        return endedAt;
    }

    public Duration duration() {
        return Duration.between(startedAt, endedAt);
    }

    public String message() {
        return message;
    }

    public Optional<ActionOutcome> outcome() {
        return Optional.ofNullable(outcome);
    }

    public Optional<Throwable> failure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return source.kind() + " " + source.id() + " " + status
                + (message.isEmpty() ? "" : " (" + message + ")");
    }
}
