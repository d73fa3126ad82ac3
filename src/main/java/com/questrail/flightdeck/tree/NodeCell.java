package com.questrail.flightdeck.tree;

import com.questrail.flightdeck.api.NodeId;
import com.questrail.flightdeck.api.NodeKind;
import com.questrail.flightdeck.api.Status;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable state shared by every node variant. Guarded by its own monitor;
 * {@code status} and {@code result} are volatile for lock-free reads.
 */
final class NodeCell
{
    final NodeId id;
    final String name;
    final NodeKind kind;
    final Testable parent;

    volatile Status status = Status.PENDING;
    volatile Result result;
    Instant startedAt;

    // Child results in arrival (completion) order.
    private final Map<NodeId, Result> received = new LinkedHashMap<>();
    private final Map<String, Integer> segmentCounts = new HashMap<>();

    NodeCell(NodeId id, String name, NodeKind kind, Testable parent) {
        this.id = id;
        this.name = name;
        this.kind = kind;
        this.parent = parent;
    }

    static NodeCell root(String name, NodeKind kind) {
        return new NodeCell(NodeId.root(segment(name)), name, kind, null);
    }

    /**
     * Allocates the cell of a new child, disambiguating duplicate names.
     */
    synchronized NodeCell newChild(String childName, NodeKind childKind, Testable self) {
        if (status != Status.PENDING) {
            throw new IllegalStateException("Cannot add " + childKind + " '" + childName
                    + "' to " + kind + " " + id + " in state " + status);
        }
        String base = segment(childName);
        int n = segmentCounts.merge(base, 1, Integer::sum);
        String seg = n == 1 ? base : base + "#" + n;
        return new NodeCell(id.child(seg), childName, childKind, self);
    }

    Optional<Testable> parent() {
        return Optional.ofNullable(parent);
    }

    Optional<Result> result() {
        return Optional.ofNullable(result);
    }

    synchronized boolean hasReceived(NodeId child) {
        return received.containsKey(child);
    }

    /**
     * @return {@code false} if a result for this child was already delivered
     */
    synchronized boolean receive(NodeId child, Result childResult) {
        return received.putIfAbsent(child, childResult) == null;
    }

    synchronized List<Result> receivedInArrivalOrder() {
        return List.copyOf(received.values());
    }

    static NodeCell of(Testable node) {
        if (node instanceof Suite s) {
            return s.cell;
        }
        if (node instanceof Case c) {
            return c.cell;
        }
        if (node instanceof Flight f) {
            return f.cell;
        }
        return ((Step) node).cell;
    }

    private static String segment(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("node name must not be blank");
        }
        return name.replace(NodeId.SEPARATOR, '_');
    }
}
