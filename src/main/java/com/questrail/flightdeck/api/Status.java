package com.questrail.flightdeck.api;

/**
 * Status
 * -----------------------------------------------------------------------------
 * Lifecycle and outcome state of a node in the testable tree.
 *
 * <h2>Lifecycle</h2>
 * Every node starts {@link #PENDING}, moves to {@link #RUNNING} when the run
 * engine begins executing it, and ends in exactly one terminal status. A node
 * that never starts (cancellation, a concluded flight, a failed case
 * preparation) goes straight from {@code PENDING} to {@link #SKIPPED}.
 *
 * <h2>Aggregation precedence</h2>
 * Terminal statuses are totally ordered for aggregation; the highest wins:
 * <pre>
 *   ERROR(4) &gt; FAILED(3) &gt; SKIPPED(2) &gt; PASSED(1)
 * </pre>
 * Non-terminal statuses have precedence 0 and never take part in a final
 * reduction.
 */
public enum Status
{
    /** Created but not yet started. */
    PENDING(0),

    /** Currently executing. */
    RUNNING(0),

    /** Completed and met its expectations. */
    PASSED(1),

    /** Never ran, or ran only partially because execution was cut short. */
    SKIPPED(2),

    /** Completed, but the product under test did not behave as expected. */
    FAILED(3),

    /**
     * Could not be assessed: the automation itself faulted, timed out, was
     * cancelled mid-flight, or a required component could not be resolved.
     */
    ERROR(4);

    private final int precedence;

    Status(int precedence) {
        this.precedence = precedence;
    }

    /**
     * Aggregation weight; higher dominates.
     */
    public int precedence() {
        return precedence;
    }

    /**
     * Returns {@code true} for statuses a node can finalize with.
     */
    public boolean isTerminal() {
        return precedence > 0;
    }

    /**
     * Returns {@code true} for outcomes that indicate a problem with the
     * product or the automation ({@link #FAILED} or {@link #ERROR}).
     */
    public boolean isBad() {
        return this == FAILED || this == ERROR;
    }

    /**
     * Returns whichever of {@code this} and {@code other} has higher
     * precedence; ties keep {@code this}.
     */
    public Status dominant(Status other) {
        return other.precedence > this.precedence ? other : this;
    }
}
