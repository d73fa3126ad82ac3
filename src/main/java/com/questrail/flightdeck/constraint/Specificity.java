package com.questrail.flightdeck.constraint;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Specificity
 * -----------------------------------------------------------------------------
 * Partial order over declared constraint sets: a declaration is more specific
 * than another when it constrains every attribute the other does, at least as
 * narrowly, and is strictly narrower somewhere (a narrower range, a smaller
 * value set, or an extra constrained attribute).
 *
 * <p>An attribute a declaration leaves unconstrained is treated as the whole
 * universe of values. Two declarations where each is narrower on some
 * attribute are {@link Comparison#INCOMPARABLE}; the resolver treats that like
 * a tie.</p>
 */
public final class Specificity
{
    public enum Comparison {
        MORE_SPECIFIC,
        LESS_SPECIFIC,
        EQUAL,
        INCOMPARABLE
    }

    private Specificity() {
    }

    /**
     * Compares {@code a} to {@code b}.
     */
    public static Comparison compare(Requirement a, Requirement b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");

        Set<String> attributes = new TreeSet<>(a.attributes());
        attributes.addAll(b.attributes());

        boolean narrower = false;
        boolean wider = false;
        for (String attribute : attributes) {
            Constraint ca = a.constraints().get(attribute);
            Constraint cb = b.constraints().get(attribute);
            boolean aInB = cb == null || (ca != null && ConstraintAlgebra.isSubsetOf(ca, cb));
            boolean bInA = ca == null || (cb != null && ConstraintAlgebra.isSubsetOf(cb, ca));
            if (!aInB && !bInA) {
                return Comparison.INCOMPARABLE;
            }
            if (aInB && !bInA) {
                narrower = true;
            } else if (bInA && !aInB) {
                wider = true;
            }
        }
        if (narrower && wider) {
            return Comparison.INCOMPARABLE;
        }
        if (narrower) {
            return Comparison.MORE_SPECIFIC;
        }
        return wider ? Comparison.LESS_SPECIFIC : Comparison.EQUAL;
    }

    /**
     * Returns {@code true} if {@code a} is strictly more specific than {@code b}.
     */
    public static boolean isMoreSpecific(Requirement a, Requirement b) {
        return compare(a, b) == Comparison.MORE_SPECIFIC;
    }
}
