package com.questrail.flightdeck.tree;

import com.questrail.flightdeck.api.NodeId;
import com.questrail.flightdeck.api.NodeKind;
import com.questrail.flightdeck.api.Status;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The leaf node: one action performed by one agent.
 */
public final class Step implements Testable
{
    final NodeCell cell;
    private final StepSettings settings;

    Step(NodeCell cell, StepSettings settings) {
        this.cell = cell;
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public StepSettings settings() {
        return settings;
    }

    @Override
    public List<Testable> children() {
        return List.of();
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
        return NodeKind.STEP;
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
        return "Step[" + cell.id + ", " + settings.action().name() + ", " + cell.status + "]";
    }
}
