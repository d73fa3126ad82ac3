package com.questrail.flightdeck.resolve;

import com.questrail.flightdeck.constraint.Requirement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * FactoryRegistry
 * =============================================================================
 * Process-wide catalogue of {@link Factory} registrations.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   registry.register(...)   → external modules contribute version-specific
 *                              implementations and protocol agents
 *   registry.freeze()        → done by the first run; read-only thereafter
 * </pre>
 * Registering after {@link #freeze()} throws {@link IllegalStateException}, so
 * every run over the same registry sees the same catalogue.
 *
 * <h2>Shared products</h2>
 * Products of {@link Lifetime#SHARED} factories are cached here rather than in
 * a run's {@link Resolver}, so they survive across runs. Construction is
 * single-flight: concurrent first requests wait for one constructor call.
 *
 * <h2>Thread Safety</h2>
 * Registration is synchronized; after freezing, the factory list is an
 * immutable snapshot and reads need no locking.
 */
public final class FactoryRegistry
{
    private static final Logger log = LoggerFactory.getLogger(FactoryRegistry.class);

    private final Object lock = new Object();
    private final List<Factory<?>> pending = new ArrayList<>();
    private final Set<String> names = new HashSet<>();
    private volatile List<Factory<?>> frozen;

    private final ConcurrentHashMap<Factory<?>, CompletableFuture<Object>> sharedProducts =
            new ConcurrentHashMap<>();

    /**
     * Registers a run-scoped factory named after its product type.
     */
    public <T> Factory<T> register(Class<T> productType, Requirement declared, Supplier<? extends T> constructor) {
        synchronized (lock) {
            String name = productType.getSimpleName() + "#" + (pending.size() + 1);
            return register(name, productType, declared, constructor, Lifetime.RUN);
        }
    }

    /**
     * Registers a named run-scoped factory.
     */
    public <T> Factory<T> register(String name, Class<T> productType, Requirement declared,
                                   Supplier<? extends T> constructor) {
        return register(name, productType, declared, constructor, Lifetime.RUN);
    }

    /**
     * Registers a named factory with an explicit lifetime.
     *
     * @throws IllegalStateException    if the registry is frozen
     * @throws IllegalArgumentException if the name is already taken
     */
    public <T> Factory<T> register(String name, Class<T> productType, Requirement declared,
                                   Supplier<? extends T> constructor, Lifetime lifetime) {
        Factory<T> factory = new Factory<>(name, productType, declared, constructor, lifetime);
        synchronized (lock) {
            if (frozen != null) {
                throw new IllegalStateException("Factory registry is frozen; cannot register '" + name + "'");
            }
            if (!names.add(name)) {
                throw new IllegalArgumentException("Duplicate factory name '" + name + "'");
            }
            pending.add(factory);
        }
        log.debug("Registered factory {}", factory);
        return factory;
    }

    /**
     * Makes the registry read-only. Idempotent.
     */
    public void freeze() {
        synchronized (lock) {
            if (frozen == null) {
                frozen = List.copyOf(pending);
                log.debug("Factory registry frozen with {} factories", frozen.size());
            }
        }
    }

    public boolean isFrozen() {
        return frozen != null;
    }

    /**
     * All factories in registration order.
     */
    public List<Factory<?>> factories() {
        List<Factory<?>> snapshot = frozen;
        if (snapshot != null) {
            return snapshot;
        }
        synchronized (lock) {
            return List.copyOf(pending);
        }
    }

    /**
     * Factories whose products are assignable to {@code productType}, in
     * registration order.
     */
    public List<Factory<?>> candidates(Class<?> productType) {
        Objects.requireNonNull(productType, "productType");
        List<Factory<?>> result = new ArrayList<>();
        for (Factory<?> f : factories()) {
            if (f.produces(productType)) {
                result.add(f);
            }
        }
        return result;
    }

    /**
     * Returns the single shared product of a {@link Lifetime#SHARED} factory,
     * constructing it on first request.
     */
    <T> T sharedInstance(Factory<T> factory, Requirement requirement) {
        if (factory.lifetime() != Lifetime.SHARED) {
            throw new IllegalArgumentException("Factory '" + factory.name() + "' is not shared");
        }
        CompletableFuture<Object> mine = new CompletableFuture<>();
        CompletableFuture<Object> existing = sharedProducts.putIfAbsent(factory, mine);
        if (existing == null) {
            try {
                T product = Resolver.construct(factory, requirement);
                mine.complete(product);
                return product;
            } catch (RuntimeException | Error e) {
                // A failed shared construction is not cached; a later run may retry.
                sharedProducts.remove(factory, mine);
                mine.completeExceptionally(e);
                throw e;
            }
        }
        return factory.productType().cast(Resolver.join(existing));
    }
}
