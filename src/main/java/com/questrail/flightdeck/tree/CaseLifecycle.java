package com.questrail.flightdeck.tree;

/**
 * CaseLifecycle
 * -----------------------------------------------------------------------------
 * Phases a {@link Case} runs around its flights.
 *
 * <pre>
 *   prepare  → establish fixtures; a failure skips every flight
 *   flights  → the case body
 *   audit    → verify side effects after the flights (only if prepare succeeded)
 *   restore  → always runs, returns the target to its original state
 * </pre>
 *
 * A failure in any phase makes the case {@code ERROR}; flights that did run
 * keep their own results.
 */
public interface CaseLifecycle
{
    CaseLifecycle NONE = new CaseLifecycle() {
    };

    default void prepare(Case testCase) throws Exception {
    }

    default void audit(Case testCase) throws Exception {
    }

    default void restore(Case testCase) throws Exception {
    }
}
