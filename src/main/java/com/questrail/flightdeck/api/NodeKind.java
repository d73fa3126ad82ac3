package com.questrail.flightdeck.api;

/**
 * The four variants of the testable tree, from the root down.
 */
public enum NodeKind
{
    SUITE,
    CASE,
    FLIGHT,
    STEP
}
