package com.questrail.flightdeck.resolve;

import com.questrail.flightdeck.api.Agent;
import com.questrail.flightdeck.constraint.Requirement;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Topology
 * =============================================================================
 * Declarative description of the abstract components a run needs: each entry
 * maps a component name onto a product type and the {@link Requirement} its
 * implementation must satisfy.
 *
 * <pre>
 *   Topology topology = Topology.builder()
 *       .agent("api", Requirement.parse("interface=REST, version>=2.3"))
 *       .agent("shell", Requirement.parse("interface=CLI"))
 *       .build();
 * </pre>
 *
 * A topology is consumed once at run start, where {@link #resolve(Resolver)}
 * binds every component before any step executes.
 */
public final class Topology
{
    /**
     * A named abstract component.
     */
    public record Component(String name, Class<?> productType, Requirement requirement)
    {
        public Component {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(productType, "productType");
            Objects.requireNonNull(requirement, "requirement");
            if (name.isBlank()) {
                throw new IllegalArgumentException("component name must not be blank");
            }
        }
    }

    private static final Topology EMPTY = new Topology(Map.of());

    private final Map<String, Component> components;

    private Topology(Map<String, Component> components) {
        this.components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
    }

    public static Topology empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Components in declaration order.
     */
    public Map<String, Component> components() {
        return components;
    }

    public Optional<Component> component(String name) {
        return Optional.ofNullable(components.get(name));
    }

    /**
     * Binds every component in declaration order. The first failure
     * propagates unchanged.
     *
     * @throws ResolutionException if any component cannot be resolved
     */
    public ResolvedTopology resolve(Resolver resolver) {
        Objects.requireNonNull(resolver, "resolver");
        Map<String, Binding<?>> bindings = new LinkedHashMap<>();
        for (Component c : components.values()) {
            bindings.put(c.name(), resolver.resolve(c.productType(), c.requirement()));
        }
        return new ResolvedTopology(bindings, Map.of());
    }

    /**
     * Binds every component, collecting unsatisfiable or unconstructible
     * components instead of failing. Ambiguity still propagates: it is never
     * tolerated.
     *
     * @throws AmbiguousResolutionException if any component is ambiguous
     */
    public ResolvedTopology resolveTolerant(Resolver resolver) {
        Objects.requireNonNull(resolver, "resolver");
        Map<String, Binding<?>> bindings = new LinkedHashMap<>();
        Map<String, ResolutionException> failures = new LinkedHashMap<>();
        for (Component c : components.values()) {
            try {
                bindings.put(c.name(), resolver.resolve(c.productType(), c.requirement()));
            } catch (AmbiguousResolutionException e) {
                throw e;
            } catch (ResolutionException e) {
                failures.put(c.name(), e);
            }
        }
        return new ResolvedTopology(bindings, failures);
    }

    @Override
    public String toString() {
        return "Topology" + components.keySet();
    }

    public static final class Builder
    {
        private final Map<String, Component> components = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder component(String name, Class<?> productType, Requirement requirement) {
            Component c = new Component(name, productType, requirement);
            if (components.putIfAbsent(name, c) != null) {
                throw new IllegalArgumentException("Duplicate component '" + name + "'");
            }
            return this;
        }

        /**
         * Declares an {@link Agent} component.
         */
        public Builder agent(String name, Requirement requirement) {
            return component(name, Agent.class, requirement);
        }

        public Topology build() {
            return components.isEmpty() ? EMPTY : new Topology(components);
        }
    }
}
