package com.questrail.flightdeck.tree;

import com.questrail.flightdeck.api.NodeId;
import com.questrail.flightdeck.api.NodeKind;
import com.questrail.flightdeck.api.Status;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * An ordered sequence of steps. Steps run strictly in declaration order;
 * a run of consecutive steps marked independent may be dispatched together.
 */
public final class Flight implements Testable
{
    final NodeCell cell;
    private final List<Step> steps = new CopyOnWriteArrayList<>();

    Flight(NodeCell cell) {
        this.cell = cell;
    }

    public Step addStep(String name, StepSettings settings) {
        Step step = new Step(cell.newChild(name, NodeKind.STEP, this), settings);
        steps.add(step);
        return step;
    }

    public List<Step> steps() {
        return List.copyOf(steps);
    }

    @Override
    public List<Step> children() {
        return steps();
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
        return NodeKind.FLIGHT;
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
        return "Flight[" + cell.id + ", " + cell.status + "]";
    }
}
