package com.questrail.flightdeck.resolve;

/**
 * How long a factory's product lives.
 */
public enum Lifetime
{
    /**
     * Constructed at most once per run, on first resolution, and released
     * when the run ends.
     */
    RUN,

    /**
     * Stateless: constructed at most once per registry and reused across runs.
     * Never released by a run.
     */
    SHARED
}
