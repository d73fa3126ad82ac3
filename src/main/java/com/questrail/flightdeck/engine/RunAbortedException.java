package com.questrail.flightdeck.engine;

/**
 * A run ended without a result tree: preparation failed before anything
 * executed, or the engine detected an internal invariant violation. The
 * cause carries the full diagnostics.
 */
public final class RunAbortedException extends RuntimeException
{
    private final String runId;

    public RunAbortedException(String runId, String message, Throwable cause) {
        super("Run " + runId + " aborted: " + message, cause);
        this.runId = runId;
    }

    public String runId() {
        return runId;
    }
}
