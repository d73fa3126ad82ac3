package com.questrail.flightdeck.constraint;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of evaluating one declaration against one requirement.
 *
 * @param unmetAttributes required attributes the declaration leaves free or
 *                        constrains incompatibly, in attribute order
 */
public record MatchReport(List<String> unmetAttributes)
{
    public MatchReport {
        unmetAttributes = List.copyOf(Objects.requireNonNull(unmetAttributes, "unmetAttributes"));
    }

    public boolean matches() {
        return unmetAttributes.isEmpty();
    }
}
