package com.questrail.flightdeck.time;

/**
 * Cancellable
 * =============================================================================
 * Minimal cancellation handle for scheduled work and callback registrations.
 *
 * <p>
 * Returned by {@link MonotonicScheduler} for armed deadlines and by the run
 * engine's cancellation token for registered cancel callbacks. It can be
 * implemented by:
 * <ul>
 *   <li>a deterministic test scheduler</li>
 *   <li>a hashed-wheel timer</li>
 *   <li>a plain callback list</li>
 * </ul>
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task or registration.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();
}
