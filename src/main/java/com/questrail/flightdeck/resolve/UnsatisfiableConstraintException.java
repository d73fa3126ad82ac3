package com.questrail.flightdeck.resolve;

import com.questrail.flightdeck.constraint.Requirement;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * No registered factory satisfies a requirement.
 *
 * <p>The diagnostic names, per candidate factory of the right product type,
 * which required attributes it leaves unmet. With no candidates at all the
 * whole requirement is unmet.</p>
 */
public final class UnsatisfiableConstraintException extends ResolutionException
{
    private final transient Map<String, List<String>> unmetByFactory;
    private final transient Set<String> unmetAttributes;

    public UnsatisfiableConstraintException(Class<?> productType,
                                            Requirement requirement,
                                            Map<String, List<String>> unmetByFactory)
    {
        super(productType, requirement, describe(productType, requirement, unmetByFactory));
        this.unmetByFactory = Map.copyOf(unmetByFactory);
        Set<String> unmet = new TreeSet<>();
        if (unmetByFactory.isEmpty()) {
            unmet.addAll(requirement.attributes());
        } else {
            unmetByFactory.values().forEach(unmet::addAll);
        }
        this.unmetAttributes = Set.copyOf(unmet);
    }

    /**
     * Unmet attributes per candidate factory name.
     */
    public Map<String, List<String>> unmetByFactory() {
        return unmetByFactory;
    }

    /**
     * Union of attributes no candidate satisfied.
     */
    public Set<String> unmetAttributes() {
        return unmetAttributes;
    }

    private static String describe(Class<?> productType, Requirement requirement,
                                   Map<String, List<String>> unmetByFactory) {
        StringBuilder sb = new StringBuilder("Unsatisfiable constraint: no ")
                .append(productType.getSimpleName())
                .append(" factory satisfies ")
                .append(requirement);
        if (unmetByFactory.isEmpty()) {
            sb.append(" (no candidates registered)");
        } else {
            sb.append(" (unmet attributes by factory: ").append(unmetByFactory).append(')');
        }
        return sb.toString();
    }
}
