package com.questrail.flightdeck.tree;

import com.questrail.flightdeck.api.Status;

import java.time.Instant;

/**
 * Receives every node status transition made by a {@link ResultAggregator},
 * on the thread that made it.
 */
@FunctionalInterface
public interface TransitionListener
{
    TransitionListener NONE = (node, from, to, at) -> { };

    void onTransition(Testable node, Status from, Status to, Instant at);
}
