package com.questrail.flightdeck.tree;

import com.questrail.flightdeck.api.NodeId;
import com.questrail.flightdeck.api.NodeKind;
import com.questrail.flightdeck.api.Status;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * ResultTree
 * -----------------------------------------------------------------------------
 * Immutable snapshot of a fully finalized tree, mirroring its shape. This is
 * what a run hands to consumers once it is over.
 */
public final class ResultTree
{
    /**
     * One node of the snapshot.
     */
    public record Node(Result result, List<Node> children)
    {
        public Node {
            Objects.requireNonNull(result, "result");
            children = List.copyOf(children);
        }

        public NodeId id() {
            return result.nodeId();
        }

        public NodeKind kind() {
            return result.kind();
        }

        public Status status() {
            return result.status();
        }
    }

    private final Node root;
    private final Map<NodeId, Node> index;

    private ResultTree(Node root) {
        this.root = root;
        Map<NodeId, Node> idx = new LinkedHashMap<>();
        walk(root, idx);
        this.index = Collections.unmodifiableMap(idx);
    }

    /**
     * Snapshots a tree.
     *
     * @throws IllegalStateException if any node is not finalized
     */
    public static ResultTree of(Testable root) {
        return new ResultTree(snapshot(root));
    }

    private static Node snapshot(Testable node) {
        Result r = node.result().orElseThrow(() ->
                new IllegalStateException("Node " + node.id() + " is not finalized (" + node.status() + ")"));
        List<Node> kids = new ArrayList<>();
        for (Testable child : node.children()) {
            kids.add(snapshot(child));
        }
        return new Node(r, kids);
    }

    private static void walk(Node node, Map<NodeId, Node> idx) {
        idx.put(node.id(), node);
        node.children().forEach(c -> walk(c, idx));
    }

    public Node root() {
        return root;
    }

    public Status status() {
        return root.status();
    }

    public Optional<Node> find(NodeId id) {
        return Optional.ofNullable(index.get(id));
    }

    public Optional<Node> find(String path) {
        return find(new NodeId(path));
    }

    /**
     * All nodes, depth-first in declaration order.
     */
    public Stream<Node> stream() {
        return index.values().stream();
    }

    /**
     * Number of nodes of one kind per status.
     */
    public Map<Status, Integer> tally(NodeKind kind) {
        Map<Status, Integer> counts = new EnumMap<>(Status.class);
        stream().filter(n -> n.kind() == kind).forEach(n -> counts.merge(n.status(), 1, Integer::sum));
        return Collections.unmodifiableMap(counts);
    }

    public int size() {
        return index.size();
    }

    @Override
    public String toString() {
        return "ResultTree[" + root.id() + " " + root.status() + ", " + index.size() + " nodes]";
    }
}
