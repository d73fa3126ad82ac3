package com.questrail.flightdeck.api;

import java.util.Objects;

/**
 * NodeId
 * -----------------------------------------------------------------------------
 * Path-style identity of a node: segments from the root joined by {@code '/'},
 * e.g. {@code "nightly/login/happy-path/submit"}.
 *
 * <p>Sibling segments are unique; the tree disambiguates duplicate sibling
 * names by appending {@code #2}, {@code #3}, ... in declaration order.</p>
 */
public record NodeId(String path)
{
    public static final char SEPARATOR = '/';

    public NodeId {
        Objects.requireNonNull(path, "path");
        if (path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
    }

    public static NodeId root(String segment) {
        return new NodeId(segment);
    }

    public NodeId child(String segment) {
        Objects.requireNonNull(segment, "segment");
        return new NodeId(path + SEPARATOR + segment);
    }

    /**
     * Number of segments; the root has depth 1.
     */
    public int depth() {
        int depth = 1;
        for (int i = 0; i < path.length(); i++) {
            if (path.charAt(i) == SEPARATOR) {
                depth++;
            }
        }
        return depth;
    }

    /**
     * The last path segment.
     */
    public String leaf() {
        int idx = path.lastIndexOf(SEPARATOR);
        return idx < 0 ? path : path.substring(idx + 1);
    }

    @Override
    public String toString() {
        return path;
    }
}
