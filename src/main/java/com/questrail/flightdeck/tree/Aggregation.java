package com.questrail.flightdeck.tree;

import com.questrail.flightdeck.api.Status;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Aggregation
 * -----------------------------------------------------------------------------
 * The reduction of child statuses into a parent status:
 *
 * <pre>
 *   status(parent) = max_by_precedence(status(child))
 *   ERROR(4) &gt; FAILED(3) &gt; SKIPPED(2) &gt; PASSED(1)
 *   no children    → PASSED
 * </pre>
 *
 * Pure and variant-agnostic; the node kind never influences the reduction.
 */
public final class Aggregation
{
    private Aggregation() {
    }

    public static Status reduce(Collection<Status> statuses) {
        Status acc = Status.PASSED;
        for (Status s : statuses) {
            if (!s.isTerminal()) {
                throw new IllegalArgumentException("cannot aggregate non-terminal status " + s);
            }
            acc = acc.dominant(s);
        }
        return acc;
    }

    /**
     * The first result, in the given order, whose status equals the reduction
     * of all of them. Empty when there are no results.
     */
    public static Optional<Result> firstDominant(List<Result> results) {
        if (results.isEmpty()) {
            return Optional.empty();
        }
        Status worst = reduce(results.stream().map(Result::status).toList());
        return results.stream().filter(r -> r.status() == worst).findFirst();
    }
}
