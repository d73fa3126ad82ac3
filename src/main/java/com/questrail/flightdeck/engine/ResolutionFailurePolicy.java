package com.questrail.flightdeck.engine;

/**
 * What an unsatisfiable (or unconstructible) requirement found while
 * preparing a run does. Ambiguity always aborts the run.
 */
public enum ResolutionFailurePolicy
{
    /** Abort the whole run before anything executes. */
    FAIL_RUN,

    /** Finalize only the affected steps as ERROR; everything else runs. */
    FAIL_NODE
}
