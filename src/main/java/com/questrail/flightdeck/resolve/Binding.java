package com.questrail.flightdeck.resolve;

import com.questrail.flightdeck.constraint.Requirement;

import java.util.Objects;

/**
 * A resolved requirement: the winning factory and the instance it produced.
 *
 * <p>Bindings are cached per run by requirement signature; two identical
 * requirements resolve to the same factory and the same instance.</p>
 *
 * @param requirement the requirement that was resolved
 * @param factory     the most specific matching factory; its product type is
 *                    {@code T} or a subtype
 * @param instance    the product
 * @param <T>         product type
 */
public record Binding<T>(Requirement requirement, Factory<?> factory, T instance)
{
    public Binding {
        Objects.requireNonNull(requirement, "requirement");
        Objects.requireNonNull(factory, "factory");
        Objects.requireNonNull(instance, "instance");
    }

    /**
     * The same binding viewed as a {@code Binding<U>}.
     *
     * @throws ClassCastException if the instance is not a {@code U}
     */
    public <U> Binding<U> as(Class<U> type) {
        return new Binding<>(requirement, factory, type.cast(instance));
    }
}
