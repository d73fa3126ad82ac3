package com.questrail.flightdeck.constraint;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ConstraintAlgebra
 * -----------------------------------------------------------------------------
 * Pure set relations between {@link Constraint} variants on the same attribute.
 *
 * <h2>Model</h2>
 * Each constraint denotes a set of attribute values:
 * <ul>
 *   <li>{@code Equals}/{@code OneOf}: a finite set</li>
 *   <li>{@code Range}: an interval of versions, treated as dense (between any
 *       two distinct versions lies another, e.g. {@code 2.3 < 2.3.1 < 2.4})</li>
 *   <li>{@code Excludes}: the complement of a finite set in an unbounded
 *       universe that also contains non-version strings</li>
 * </ul>
 *
 * All methods are total and side-effect free. Callers are responsible for
 * only relating constraints on the same attribute.
 */
public final class ConstraintAlgebra
{
    private ConstraintAlgebra() {
    }

    /**
     * Returns {@code true} if {@code value} satisfies {@code constraint}.
     */
    public static boolean admits(Constraint constraint, String value) {
        Objects.requireNonNull(constraint, "constraint");
        if (value == null) {
            return false;
        }
        if (constraint instanceof Constraint.Equals c) {
            return sameValue(c.value(), value);
        }
        if (constraint instanceof Constraint.OneOf c) {
            return containsValue(c.values(), value);
        }
        if (constraint instanceof Constraint.Excludes c) {
            return !containsValue(c.values(), value);
        }
        Constraint.Range r = (Constraint.Range) constraint;
        Optional<Version> v = Version.tryParse(value);
        return v.isPresent() && rangeAdmits(r, v.get());
    }

    /**
     * Returns {@code true} if every value admitted by {@code a} is admitted by
     * {@code b} (i.e. {@code a} is the same as or narrower than {@code b}).
     */
    public static boolean isSubsetOf(Constraint a, Constraint b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");

        Optional<Set<String>> finite = finiteValues(a);
        if (finite.isPresent()) {
            return finite.get().stream().allMatch(b::admits);
        }

        if (a instanceof Constraint.Range ra) {
            if (b instanceof Constraint.Range rb) {
                return lowerWithin(ra, rb) && upperWithin(ra, rb);
            }
            if (b instanceof Constraint.Excludes eb) {
                return eb.values().stream().noneMatch(ra::admits);
            }
            // Only a single-point range can fit inside a finite set.
            return ra.isPoint() && b.admits(ra.lower().toString());
        }

        // a is Excludes: an infinite complement only fits in a wider complement.
        Constraint.Excludes ea = (Constraint.Excludes) a;
        if (b instanceof Constraint.Excludes eb) {
            return eb.values().stream().allMatch(v -> containsValue(ea.values(), v));
        }
        return false;
    }

    /**
     * Returns {@code true} if some value is admitted by both constraints.
     */
    public static boolean intersects(Constraint a, Constraint b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");

        Optional<Set<String>> finiteA = finiteValues(a);
        if (finiteA.isPresent()) {
            return finiteA.get().stream().anyMatch(b::admits);
        }
        Optional<Set<String>> finiteB = finiteValues(b);
        if (finiteB.isPresent()) {
            return finiteB.get().stream().anyMatch(a::admits);
        }

        if (a instanceof Constraint.Range ra && b instanceof Constraint.Range rb) {
            return rangesOverlap(ra, rb);
        }
        if (a instanceof Constraint.Range ra && b instanceof Constraint.Excludes) {
            return !ra.isPoint() || b.admits(ra.lower().toString());
        }
        if (a instanceof Constraint.Excludes && b instanceof Constraint.Range rb) {
            return !rb.isPoint() || a.admits(rb.lower().toString());
        }
        // Two complements of finite sets always share values.
        return true;
    }

    /**
     * Returns {@code true} if both constraints admit exactly the same values.
     */
    public static boolean equivalent(Constraint a, Constraint b) {
        return isSubsetOf(a, b) && isSubsetOf(b, a);
    }

    /**
     * Intersects two ranges on the same attribute.
     *
     * @throws IllegalArgumentException if the ranges do not overlap
     */
    public static Constraint.Range intersectRanges(Constraint.Range a, Constraint.Range b) {
        Version lower = a.lower();
        boolean lowerInclusive = a.lowerInclusive();
        if (b.lower() != null) {
            int cmp = lower == null ? -1 : lower.compareTo(b.lower());
            if (cmp < 0 || (cmp == 0 && !b.lowerInclusive())) {
                lower = b.lower();
                lowerInclusive = b.lowerInclusive();
            }
        }
        Version upper = a.upper();
        boolean upperInclusive = a.upperInclusive();
        if (b.upper() != null) {
            int cmp = upper == null ? 1 : upper.compareTo(b.upper());
            if (cmp > 0 || (cmp == 0 && !b.upperInclusive())) {
                upper = b.upper();
                upperInclusive = b.upperInclusive();
            }
        }
        return new Constraint.Range(a.attribute(), lower, lowerInclusive, upper, upperInclusive);
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    static boolean sameValue(String a, String b) {
        if (a.equals(b)) {
            return true;
        }
        Optional<Version> va = Version.tryParse(a);
        Optional<Version> vb = Version.tryParse(b);
        return va.isPresent() && vb.isPresent() && va.get().compareTo(vb.get()) == 0;
    }

    private static boolean containsValue(Set<String> values, String value) {
        for (String v : values) {
            if (sameValue(v, value)) {
                return true;
            }
        }
        return false;
    }

    private static Optional<Set<String>> finiteValues(Constraint c) {
        if (c instanceof Constraint.Equals e) {
            return Optional.of(Set.of(e.value()));
        }
        if (c instanceof Constraint.OneOf o) {
            return Optional.of(o.values());
        }
        return Optional.empty();
    }

    private static boolean rangeAdmits(Constraint.Range r, Version v) {
        if (r.lower() != null) {
            int cmp = v.compareTo(r.lower());
            if (cmp < 0 || (cmp == 0 && !r.lowerInclusive())) {
                return false;
            }
        }
        if (r.upper() != null) {
            int cmp = v.compareTo(r.upper());
            if (cmp > 0 || (cmp == 0 && !r.upperInclusive())) {
                return false;
            }
        }
        return true;
    }

    /** a's lower bound is at or above b's lower bound. */
    private static boolean lowerWithin(Constraint.Range a, Constraint.Range b) {
        if (b.lower() == null) {
            return true;
        }
        if (a.lower() == null) {
            return false;
        }
        int cmp = a.lower().compareTo(b.lower());
        return cmp > 0 || (cmp == 0 && (b.lowerInclusive() || !a.lowerInclusive()));
    }

    /** a's upper bound is at or below b's upper bound. */
    private static boolean upperWithin(Constraint.Range a, Constraint.Range b) {
        if (b.upper() == null) {
            return true;
        }
        if (a.upper() == null) {
            return false;
        }
        int cmp = a.upper().compareTo(b.upper());
        return cmp < 0 || (cmp == 0 && (b.upperInclusive() || !a.upperInclusive()));
    }

    private static boolean rangesOverlap(Constraint.Range a, Constraint.Range b) {
        // Versions are dense, so overlap fails only when one range ends before
        // the other begins, or they touch at a point one of them excludes.
        if (a.upper() != null && b.lower() != null) {
            int cmp = a.upper().compareTo(b.lower());
            if (cmp < 0 || (cmp == 0 && !(a.upperInclusive() && b.lowerInclusive()))) {
                return false;
            }
        }
        if (b.upper() != null && a.lower() != null) {
            int cmp = b.upper().compareTo(a.lower());
            if (cmp < 0 || (cmp == 0 && !(b.upperInclusive() && a.lowerInclusive()))) {
                return false;
            }
        }
        return true;
    }
}
