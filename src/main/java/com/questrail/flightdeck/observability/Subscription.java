package com.questrail.flightdeck.observability;

/**
 * Handle for cancelling a progress subscription.
 */
@FunctionalInterface
public interface Subscription {
    void unsubscribe();
}
