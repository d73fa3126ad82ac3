package com.questrail.flightdeck.tree;

import com.questrail.flightdeck.api.NodeId;
import com.questrail.flightdeck.api.NodeKind;
import com.questrail.flightdeck.api.Status;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * An ordered collection of cases and nested suites. By default members run in
 * parallel, bounded by the run's worker limit.
 */
public final class Suite implements SuiteMember
{
    final NodeCell cell;
    private final ExecutionPolicy policy;
    private final List<SuiteMember> members = new CopyOnWriteArrayList<>();

    private Suite(NodeCell cell, ExecutionPolicy policy) {
        this.cell = cell;
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public static Suite root(String name) {
        return root(name, ExecutionPolicy.parallel());
    }

    public static Suite root(String name, ExecutionPolicy policy) {
        return new Suite(NodeCell.root(name, NodeKind.SUITE), policy);
    }

    public Suite addSuite(String name, ExecutionPolicy policy) {
        Suite child = new Suite(cell.newChild(name, NodeKind.SUITE, this), policy);
        members.add(child);
        return child;
    }

    public Case addCase(String name) {
        return addCase(name, CaseLifecycle.NONE, ExecutionPolicy.sequential());
    }

    public Case addCase(String name, CaseLifecycle lifecycle, ExecutionPolicy policy) {
        Case child = new Case(cell.newChild(name, NodeKind.CASE, this), lifecycle, policy);
        members.add(child);
        return child;
    }

    public ExecutionPolicy policy() {
        return policy;
    }

    public List<SuiteMember> members() {
        return List.copyOf(members);
    }

    @Override
    public List<SuiteMember> children() {
        return members();
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
        return NodeKind.SUITE;
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
        return "Suite[" + cell.id + ", " + cell.status + "]";
    }
}
