package com.questrail.flightdeck.constraint;

import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Constraint
 * -----------------------------------------------------------------------------
 * A predicate over one named attribute (interface kind, product, version,
 * environment, ...). Constraints describe both what a test <em>requires</em>
 * and what a factory <em>declares</em> it provides.
 *
 * <h2>Tagged variants</h2>
 * The set of predicate shapes is closed:
 * <ul>
 *   <li>{@link Equals} &ndash; exactly one value</li>
 *   <li>{@link OneOf} &ndash; any of a finite set of values</li>
 *   <li>{@link Excludes} &ndash; anything but a finite set of values</li>
 *   <li>{@link Range} &ndash; an interval of {@link Version}s, either end optional</li>
 * </ul>
 *
 * Set relations between variants (subset, intersection) live in
 * {@link ConstraintAlgebra} so they can be reasoned about and tested in one
 * place.
 *
 * <h2>Values</h2>
 * Attribute values are strings. Two values are the same when they are equal
 * strings, or when both parse as {@link Version}s that compare equal.
 */
public sealed interface Constraint
        permits Constraint.Equals, Constraint.OneOf, Constraint.Excludes, Constraint.Range
{
    /**
     * Name of the constrained attribute.
     */
    String attribute();

    /**
     * Returns {@code true} if the value satisfies this predicate.
     */
    default boolean admits(String value) {
        return ConstraintAlgebra.admits(this, value);
    }

    /**
     * Canonical rendering of the predicate without the attribute name; stable
     * across equivalent inputs and used in requirement signatures.
     */
    String canonicalPredicate();

    /**
     * Builds a constraint from an operator triple. Ordering operators produce a
     * version {@link Range}.
     */
    static Constraint of(String attribute, Operator operator, String value) {
        Objects.requireNonNull(operator, "operator");
        return switch (operator) {
            case EQ -> new Equals(attribute, value);
            case NE -> new Excludes(attribute, Set.of(value));
            case LT -> new Range(attribute, null, false, Version.parse(value), false);
            case LE -> new Range(attribute, null, false, Version.parse(value), true);
            case GT -> new Range(attribute, Version.parse(value), false, null, false);
            case GE -> new Range(attribute, Version.parse(value), true, null, false);
        };
    }

    /** Exactly one admitted value. */
    record Equals(String attribute, String value) implements Constraint {
        public Equals {
            requireAttribute(attribute);
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String canonicalPredicate() {
            return "=" + value;
        }
    }

    /** A finite set of admitted values. */
    record OneOf(String attribute, Set<String> values) implements Constraint {
        public OneOf {
            requireAttribute(attribute);
            values = sortedCopy(values);
            if (values.isEmpty()) {
                throw new IllegalArgumentException("OneOf requires at least one value");
            }
        }

        @Override
        public String canonicalPredicate() {
            return "=" + String.join("|", values);
        }
    }

    /** Every value except a finite set. */
    record Excludes(String attribute, Set<String> values) implements Constraint {
        public Excludes {
            requireAttribute(attribute);
            values = sortedCopy(values);
            if (values.isEmpty()) {
                throw new IllegalArgumentException("Excludes requires at least one value");
            }
        }

        @Override
        public String canonicalPredicate() {
            return "!=" + String.join("|", values);
        }
    }

    /**
     * A version interval. A {@code null} bound is unbounded on that side.
     * Empty intervals are rejected at construction.
     */
    record Range(String attribute,
                 Version lower, boolean lowerInclusive,
                 Version upper, boolean upperInclusive) implements Constraint {
        public Range {
            requireAttribute(attribute);
            if (lower == null && upper == null) {
                throw new IllegalArgumentException("Range on '" + attribute + "' needs at least one bound");
            }
            if (lower == null) {
                lowerInclusive = false;
            }
            if (upper == null) {
                upperInclusive = false;
            }
            if (lower != null && upper != null) {
                int cmp = lower.compareTo(upper);
                if (cmp > 0 || (cmp == 0 && !(lowerInclusive && upperInclusive))) {
                    throw new IllegalArgumentException("Empty range on '" + attribute + "'");
                }
            }
        }

        public Optional<Version> lowerBound() {
            return Optional.ofNullable(lower);
        }

        public Optional<Version> upperBound() {
            return Optional.ofNullable(upper);
        }

        /**
         * Returns {@code true} when the range admits exactly one version.
         */
        public boolean isPoint() {
            return lower != null && upper != null && lower.compareTo(upper) == 0;
        }

        @Override
        public String canonicalPredicate() {
            return " in " + (lowerInclusive ? "[" : "(")
                    + (lower == null ? "*" : lower.toString())
                    + ","
                    + (upper == null ? "*" : upper.toString())
                    + (upperInclusive ? "]" : ")");
        }
    }

    private static void requireAttribute(String attribute) {
        Objects.requireNonNull(attribute, "attribute");
        if (attribute.isBlank()) {
            throw new IllegalArgumentException("attribute must not be blank");
        }
    }

    private static Set<String> sortedCopy(Set<String> values) {
        Objects.requireNonNull(values, "values");
        return Collections.unmodifiableSet(new TreeSet<>(values));
    }
}
