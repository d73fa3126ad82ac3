package com.questrail.flightdeck.tree;

import com.questrail.flightdeck.api.NodeId;
import com.questrail.flightdeck.api.NodeKind;
import com.questrail.flightdeck.api.Status;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A test case: ordered flights wrapped in {@link CaseLifecycle} phases.
 * Flights run sequentially by default since they usually share fixture state.
 */
public final class Case implements SuiteMember
{
    final NodeCell cell;
    private final CaseLifecycle lifecycle;
    private final ExecutionPolicy policy;
    private final List<Flight> flights = new CopyOnWriteArrayList<>();

    Case(NodeCell cell, CaseLifecycle lifecycle, ExecutionPolicy policy) {
        this.cell = cell;
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public Flight addFlight(String name) {
        Flight flight = new Flight(cell.newChild(name, NodeKind.FLIGHT, this));
        flights.add(flight);
        return flight;
    }

    public CaseLifecycle lifecycle() {
        return lifecycle;
    }

    public ExecutionPolicy policy() {
        return policy;
    }

    public List<Flight> flights() {
        return List.copyOf(flights);
    }

    @Override
    public List<Flight> children() {
        return flights();
    }

    @Override
    public NodeId id() {
        return cell.id;
    }

    @Override
    public String name() {
        return cell.name;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CASE;
    }

    @Override
    public Optional<Testable> parent() {
        return cell.parent();
    }

    @Override
    public Status status() {
        return cell.status;
    }

    @Override
    public Optional<Result> result() {
        return cell.result();
    }

    @Override
    public String toString() {
        return "Case[" + cell.id + ", " + cell.status + "]";
    }
}
