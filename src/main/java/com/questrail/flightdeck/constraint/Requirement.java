package com.questrail.flightdeck.constraint;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Requirement
 * -----------------------------------------------------------------------------
 * An immutable set of {@link Constraint}s, at most one per attribute, ordered
 * by attribute name.
 *
 * <p>The same type describes both sides of resolution: what a test asks for
 * ("interface=REST, version&gt;=2.3") and what a factory declares it provides
 * ("interface=REST, version in [2.0,3.0)").</p>
 *
 * <h2>Signature</h2>
 * {@link #signature()} renders the constraints in attribute order with their
 * canonical predicates. Two requirements with the same signature admit the
 * same attribute sets and resolve to the same binding.
 *
 * <h2>Text form</h2>
 * {@link #parse(String)} accepts comma-separated clauses:
 * <pre>
 *   interface=REST             equality (also ==)
 *   os=linux|mac               one of
 *   env!=prod                  anything but (also env!=prod|staging)
 *   version&gt;=2.3, version&lt;3  version range; clauses on one attribute intersect
 * </pre>
 */
public final class Requirement
{
    private static final Requirement EMPTY = new Requirement(new TreeMap<>());

    private static final Pattern CLAUSE =
            Pattern.compile("\\s*([A-Za-z_][A-Za-z0-9_.\\-]*)\\s*(==|!=|>=|<=|=|>|<)\\s*(\\S.*?)\\s*");

    private final SortedMap<String, Constraint> constraints;
    private final String signature;

    private Requirement(SortedMap<String, Constraint> constraints) {
        this.constraints = Collections.unmodifiableSortedMap(constraints);
        StringBuilder sb = new StringBuilder();
        for (Constraint c : constraints.values()) {
            if (sb.length() > 0) {
                sb.append(';');
            }
            sb.append(c.attribute()).append(c.canonicalPredicate());
        }
        this.signature = sb.toString();
    }

    /**
     * The requirement with no constraints (matches any declaration).
     */
    public static Requirement none() {
        return EMPTY;
    }

    public static Requirement of(Constraint... constraints) {
        return of(List.of(constraints));
    }

    public static Requirement of(Collection<? extends Constraint> constraints) {
        Builder b = builder();
        constraints.forEach(b::with);
        return b.build();
    }

    /**
     * Parses the textual clause form described in the class documentation.
     *
     * @throws IllegalArgumentException on malformed clauses or conflicting attributes
     */
    public static Requirement parse(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isBlank()) {
            return EMPTY;
        }
        Builder b = builder();
        for (String clause : text.split(",")) {
            Matcher m = CLAUSE.matcher(clause);
            if (!m.matches()) {
                throw new IllegalArgumentException("Malformed constraint clause: '" + clause.trim() + "'");
            }
            String attribute = m.group(1);
            String op = m.group(2);
            String value = m.group(3);
            switch (op) {
                case "=", "==" -> b.with(valueSet(attribute, value, false));
                case "!=" -> b.with(valueSet(attribute, value, true));
                case ">=" -> b.with(Constraint.of(attribute, Operator.GE, value));
                case ">" -> b.with(Constraint.of(attribute, Operator.GT, value));
                case "<=" -> b.with(Constraint.of(attribute, Operator.LE, value));
                case "<" -> b.with(Constraint.of(attribute, Operator.LT, value));
                default -> throw new IllegalArgumentException("Unsupported operator: " + op);
            }
        }
        return b.build();
    }

    private static Constraint valueSet(String attribute, String text, boolean exclude) {
        Set<String> values = new LinkedHashSet<>();
        for (String v : text.split("\\|")) {
            String trimmed = v.trim();
            if (trimmed.isEmpty()) {
                throw new IllegalArgumentException("Empty value in clause for '" + attribute + "'");
            }
            values.add(trimmed);
        }
        if (exclude) {
            return new Constraint.Excludes(attribute, values);
        }
        if (values.size() == 1) {
            return new Constraint.Equals(attribute, values.iterator().next());
        }
        return new Constraint.OneOf(attribute, values);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Constraints keyed by attribute, in attribute order.
     */
    public SortedMap<String, Constraint> constraints() {
        return constraints;
    }

    public Set<String> attributes() {
        return constraints.keySet();
    }

    public Optional<Constraint> constraint(String attribute) {
        return Optional.ofNullable(constraints.get(attribute));
    }

    public boolean isEmpty() {
        return constraints.isEmpty();
    }

    /**
     * Canonical, attribute-sorted rendering used as the resolution cache key.
     */
    public String signature() {
        return signature;
    }

    /**
     * Evaluates a factory's declared constraints against this requirement.
     *
     * <p>The declaration satisfies the requirement when, for every attribute
     * this requirement constrains, the declaration constrains it too with a
     * compatible (overlapping) or narrower predicate.</p>
     */
    public MatchReport match(Requirement declared) {
        Objects.requireNonNull(declared, "declared");
        List<String> unmet = new ArrayList<>();
        for (Map.Entry<String, Constraint> e : constraints.entrySet()) {
            Constraint offered = declared.constraints.get(e.getKey());
            if (offered == null || !ConstraintAlgebra.intersects(e.getValue(), offered)) {
                unmet.add(e.getKey());
            }
        }
        return new MatchReport(unmet);
    }

    /**
     * Returns a new requirement with {@code other}'s constraints merged in.
     *
     * @throws IllegalArgumentException if both constrain an attribute in a way
     *         that cannot be merged
     */
    public Requirement and(Requirement other) {
        Builder b = builder();
        constraints.values().forEach(b::with);
        other.constraints.values().forEach(b::with);
        return b.build();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Requirement r && signature.equals(r.signature);
    }

    @Override
    public int hashCode() {
        return signature.hashCode();
    }

    @Override
    public String toString() {
        return "{" + signature + "}";
    }

    /**
     * Incremental builder; ranges on the same attribute are intersected.
     */
    public static final class Builder
    {
        private final SortedMap<String, Constraint> constraints = new TreeMap<>();

        private Builder() {
        }

        public Builder with(Constraint constraint) {
            Objects.requireNonNull(constraint, "constraint");
            Constraint prior = constraints.get(constraint.attribute());
            if (prior == null) {
                constraints.put(constraint.attribute(), constraint);
            } else if (prior instanceof Constraint.Range a && constraint instanceof Constraint.Range b) {
                constraints.put(constraint.attribute(), ConstraintAlgebra.intersectRanges(a, b));
            } else if (!ConstraintAlgebra.equivalent(prior, constraint)) {
                throw new IllegalArgumentException("Conflicting constraints on '" + constraint.attribute()
                        + "': " + prior.canonicalPredicate() + " and " + constraint.canonicalPredicate());
            }
            return this;
        }

        public Builder eq(String attribute, String value) {
            return with(new Constraint.Equals(attribute, value));
        }

        public Builder oneOf(String attribute, String... values) {
            return with(new Constraint.OneOf(attribute, Set.of(values)));
        }

        public Builder not(String attribute, String... values) {
            return with(new Constraint.Excludes(attribute, Set.of(values)));
        }

        public Builder atLeast(String attribute, String version) {
            return with(Constraint.of(attribute, Operator.GE, version));
        }

        public Builder below(String attribute, String version) {
            return with(Constraint.of(attribute, Operator.LT, version));
        }

        public Builder op(String attribute, Operator operator, String value) {
            return with(Constraint.of(attribute, operator, value));
        }

        public Requirement build() {
            return new Requirement(new TreeMap<>(constraints));
        }
    }
}
