package com.questrail.flightdeck.tree;

/**
 * A node that can sit directly under a {@link Suite}.
 */
public sealed interface SuiteMember extends Testable permits Suite, Case
{
}
