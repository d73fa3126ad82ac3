package com.questrail.flightdeck.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for operational correctness.
 *
 * <h2>Binding invariant</h2>
 * All step deadlines, cancellation grace periods and elapsed-time measurements
 * MUST use a monotonic time source. Wall-clock time (e.g. {@code Instant.now()})
 * is permitted only for result timestamps and progress events.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
