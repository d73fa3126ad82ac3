package com.questrail.flightdeck.resolve;

import com.questrail.flightdeck.constraint.Requirement;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A registered constructor bound to the constraint set it declares to satisfy.
 *
 * @param name        unique name within the registry, used in diagnostics
 * @param productType type of object produced (an {@code Agent}, an {@code Action}, ...)
 * @param declared    constraints the product satisfies
 * @param constructor creates a new product instance
 * @param lifetime    per-run or shared across runs
 * @param <T>         product type
 */
public record Factory<T>(String name,
                         Class<T> productType,
                         Requirement declared,
                         Supplier<? extends T> constructor,
                         Lifetime lifetime)
{
    public Factory {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(productType, "productType");
        Objects.requireNonNull(declared, "declared");
        Objects.requireNonNull(constructor, "constructor");
        Objects.requireNonNull(lifetime, "lifetime");
    }

    /**
     * Returns {@code true} if this factory's products can be used where
     * {@code requested} is expected.
     */
    public boolean produces(Class<?> requested) {
        return requested.isAssignableFrom(productType);
    }

    @Override
    public String toString() {
        return name + "<" + productType.getSimpleName() + ">" + declared;
    }
}
