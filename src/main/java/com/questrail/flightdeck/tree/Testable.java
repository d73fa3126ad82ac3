package com.questrail.flightdeck.tree;

import com.questrail.flightdeck.api.NodeId;
import com.questrail.flightdeck.api.NodeKind;
import com.questrail.flightdeck.api.Status;

import java.util.List;
import java.util.Optional;

/**
 * Testable
 * =============================================================================
 * A node of the execution tree. The set of variants is closed:
 *
 * <pre>
 *   Suite  → ordered Suites and Cases
 *   Case   → ordered Flights
 *   Flight → ordered Steps
 *   Step   → leaf; its result comes from an agent
 * </pre>
 *
 * <h2>Ownership</h2>
 * Each node owns its children; the parent link is a non-owning back reference.
 * Children can only be added while the node is still {@link Status#PENDING}.
 *
 * <h2>Mutation</h2>
 * Status and result change only through {@link ResultAggregator}. Once a node
 * has a {@link Result} it never changes again.
 */
public sealed interface Testable permits SuiteMember, Flight, Step
{
    NodeId id();

    String name();

    NodeKind kind();

    Optional<Testable> parent();

    List<? extends Testable> children();

    Status status();

    Optional<Result> result();

    default boolean isFinalized() {
        return result().isPresent();
    }
}
