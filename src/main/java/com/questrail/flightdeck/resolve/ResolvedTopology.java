package com.questrail.flightdeck.resolve;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Concrete bindings of a {@link Topology}, by component name, plus the
 * components that could not be bound when resolved tolerantly.
 */
public final class ResolvedTopology
{
    private final Map<String, Binding<?>> bindings;
    private final Map<String, ResolutionException> failures;

    ResolvedTopology(Map<String, Binding<?>> bindings, Map<String, ResolutionException> failures) {
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public Map<String, Binding<?>> bindings() {
        return bindings;
    }

    public Optional<Binding<?>> binding(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    public Map<String, ResolutionException> failures() {
        return failures;
    }

    public Optional<ResolutionException> failure(String name) {
        return Optional.ofNullable(failures.get(name));
    }

    /**
     * The bound product of a component, checked against the expected type.
     *
     * @throws IllegalArgumentException if no such component is bound or its
     *                                  product is not a {@code type}
     */
    public <T> T instance(String name, Class<T> type) {
        Binding<?> b = bindings.get(name);
        if (b == null) {
            throw new IllegalArgumentException("Unbound topology component '" + name + "'");
        }
        if (!type.isInstance(b.instance())) {
            throw new IllegalArgumentException("Component '" + name + "' is a "
                    + b.instance().getClass().getName() + ", not a " + type.getName());
        }
        return type.cast(b.instance());
    }

    public int size() {
        return bindings.size();
    }
}
