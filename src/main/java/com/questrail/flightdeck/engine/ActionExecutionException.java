package com.questrail.flightdeck.engine;

import com.questrail.flightdeck.api.NodeId;

/**
 * An agent raised a fault while executing a step's action. Always isolated to
 * that step; recorded as the step result's failure.
 */
public final class ActionExecutionException extends RuntimeException
{
    private final NodeId step;
    private final String action;

    public ActionExecutionException(NodeId step, String action, Throwable cause) {
        super("Action '" + action + "' of step " + step + " failed: " + describe(cause), cause);
        this.step = step;
        this.action = action;
    }

    public ActionExecutionException(NodeId step, String action, String reason) {
        super("Action '" + action + "' of step " + step + " failed: " + reason);
        this.step = step;
        this.action = action;
    }

    public NodeId step() {
        return step;
    }

    public String action() {
        return action;
    }

    private static String describe(Throwable cause) {
        String msg = cause.getMessage();
        return msg == null ? cause.getClass().getSimpleName() : cause.getClass().getSimpleName() + ": " + msg;
    }
}
