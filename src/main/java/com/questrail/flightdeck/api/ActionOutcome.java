package com.questrail.flightdeck.api;

import java.util.Map;
import java.util.Objects;

/**
 * What an {@link Agent} reports after executing an {@link Action}.
 *
 * @param status  terminal status observed by the agent; never PENDING or RUNNING
 * @param message human-readable elaboration (may be empty)
 * @param details captured output of the action (response bodies, exit codes, ...)
 */
public record ActionOutcome(Status status, String message, Map<String, Object> details)
{
    public ActionOutcome {
        Objects.requireNonNull(status, "status");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("outcome status must be terminal: " + status);
        }
        message = message == null ? "" : message;
        details = Map.copyOf(Objects.requireNonNull(details, "details"));
    }

    public static ActionOutcome passed(String message) {
        return new ActionOutcome(Status.PASSED, message, Map.of());
    }

    public static ActionOutcome failed(String message) {
        return new ActionOutcome(Status.FAILED, message, Map.of());
    }

    public static ActionOutcome skipped(String message) {
        return new ActionOutcome(Status.SKIPPED, message, Map.of());
    }

    public ActionOutcome withDetails(Map<String, Object> details) {
        return new ActionOutcome(status, message, details);
    }
}
