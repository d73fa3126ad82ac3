package com.questrail.flightdeck.engine;

import com.questrail.flightdeck.api.NodeId;

import java.time.Duration;

/**
 * A step's action did not complete before its deadline.
 */
public final class ActionTimeoutException extends RuntimeException
{
    private final NodeId step;
    private final Duration timeout;

    public ActionTimeoutException(NodeId step, String action, Duration timeout) {
        super("Action '" + action + "' of step " + step + " timed out after " + timeout.toMillis() + " ms");
        this.step = step;
        this.timeout = timeout;
    }

    public NodeId step() {
        return step;
    }

    public Duration timeout() {
        return timeout;
    }
}
