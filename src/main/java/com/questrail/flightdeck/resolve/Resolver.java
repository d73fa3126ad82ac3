package com.questrail.flightdeck.resolve;

import com.questrail.flightdeck.api.Agent;
import com.questrail.flightdeck.constraint.MatchReport;
import com.questrail.flightdeck.constraint.Requirement;
import com.questrail.flightdeck.constraint.Specificity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Resolver
 * =============================================================================
 * Run-scoped constraint-satisfaction resolver: maps a requirement onto the most
 * specific matching factory and instantiates its product.
 *
 * <h2>Matching</h2>
 * A factory is a candidate when its product type is assignable to the requested
 * type and its declared constraints satisfy the requirement (see
 * {@link Requirement#match(Requirement)}).
 *
 * <h2>Selection</h2>
 * Among candidates, the winner is the unique one not dominated by any other
 * under {@link Specificity}. If several remain (equal or incomparable
 * specificity), resolution fails with {@link AmbiguousResolutionException};
 * with no candidates it fails with {@link UnsatisfiableConstraintException}.
 *
 * <h2>Caching</h2>
 * Results are memoized by (product type, requirement signature) for the life of
 * the run. Entries are write-once {@link CompletableFuture}s: the first caller
 * for a key resolves and constructs, concurrent callers for the same key wait
 * for that result. A factory constructor therefore runs at most once per key,
 * and failures are cached just like successes. An {@link Error} thrown by a
 * constructor is cached too and rethrown to every waiter.
 *
 * <h2>Release</h2>
 * {@link #close()} releases every {@link Agent} this resolver constructed from
 * a {@link Lifetime#RUN} factory. Shared products are left alone.
 */
public final class Resolver implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(Resolver.class);

    private record Key(Class<?> productType, String signature) {}

    private final FactoryRegistry registry;
    private final ConcurrentHashMap<Key, CompletableFuture<Binding<?>>> cache = new ConcurrentHashMap<>();
    private final List<Object> runScopedProducts = new ArrayList<>();
    private volatile boolean closed;

    /**
     * Creates a resolver over the registry, freezing it.
     */
    public Resolver(FactoryRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        registry.freeze();
    }

    /**
     * Resolves a requirement to a binding, constructing the product on first use.
     *
     * @throws UnsatisfiableConstraintException if no factory matches
     * @throws AmbiguousResolutionException     if the best matches tie
     * @throws FactoryConstructionException     if the winning constructor fails
     */
    public <T> Binding<T> resolve(Class<T> productType, Requirement requirement) {
        Objects.requireNonNull(productType, "productType");
        Objects.requireNonNull(requirement, "requirement");
        if (closed) {
            throw new IllegalStateException("Resolver is closed");
        }

        Key key = new Key(productType, requirement.signature());
        CompletableFuture<Binding<?>> mine = new CompletableFuture<>();
        CompletableFuture<Binding<?>> existing = cache.putIfAbsent(key, mine);
        if (existing != null) {
            log.trace("Resolution cache hit for {} {}", productType.getSimpleName(), requirement);
            return join(existing).as(productType);
        }

        try {
            Binding<T> binding = bind(productType, requirement);
            mine.complete(binding);
            return binding;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        }
    }

    /**
     * Convenience: resolves and returns only the product.
     */
    public <T> T instance(Class<T> productType, Requirement requirement) {
        return resolve(productType, requirement).instance();
    }

    /**
     * Number of cached resolutions (successful or failed).
     */
    public int cachedResolutions() {
        return cache.size();
    }

    /**
     * Selects the winning factory without constructing anything.
     */
    public Factory<?> select(Class<?> productType, Requirement requirement) {
        List<Factory<?>> matches = new ArrayList<>();
        Map<String, List<String>> unmet = new LinkedHashMap<>();
        for (Factory<?> f : registry.candidates(productType)) {
            MatchReport report = requirement.match(f.declared());
            if (report.matches()) {
                matches.add(f);
            } else {
                unmet.put(f.name(), report.unmetAttributes());
            }
        }
        if (matches.isEmpty()) {
            throw new UnsatisfiableConstraintException(productType, requirement, unmet);
        }

        List<Factory<?>> maximal = new ArrayList<>();
        for (Factory<?> f : matches) {
            boolean dominated = false;
            for (Factory<?> other : matches) {
                if (other != f && Specificity.isMoreSpecific(other.declared(), f.declared())) {
                    dominated = true;
                    break;
                }
            }
            if (!dominated) {
                maximal.add(f);
            }
        }
        if (maximal.size() != 1) {
            List<String> names = new ArrayList<>();
            maximal.forEach(f -> names.add(f.name()));
            throw new AmbiguousResolutionException(productType, requirement, names);
        }
        return maximal.get(0);
    }

    private <T> Binding<T> bind(Class<T> productType, Requirement requirement) {
        Factory<?> winner = select(productType, requirement);
        T instance = productType.cast(instantiate(winner, requirement));
        log.debug("Resolved {} {} -> factory '{}'", productType.getSimpleName(), requirement, winner.name());
        return new Binding<>(requirement, winner, instance);
    }

    private <P> P instantiate(Factory<P> factory, Requirement requirement) {
        if (factory.lifetime() == Lifetime.SHARED) {
            return registry.sharedInstance(factory, requirement);
        }
        P product = construct(factory, requirement);
        synchronized (runScopedProducts) {
            runScopedProducts.add(product);
        }
        return product;
    }

    /**
     * Releases run-scoped agents in reverse construction order. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        List<Object> products;
        synchronized (runScopedProducts) {
            products = new ArrayList<>(runScopedProducts);
            runScopedProducts.clear();
        }
        for (int i = products.size() - 1; i >= 0; i--) {
            if (products.get(i) instanceof Agent agent) {
                try {
                    agent.release();
                } catch (RuntimeException e) {
                    log.warn("Agent {} failed to release: {}", agent, e.getMessage(), e);
                }
            }
        }
    }

    // ---------------------------------------------------------------------
    // Shared with FactoryRegistry
    // ---------------------------------------------------------------------

    static <P> P construct(Factory<P> factory, Requirement requirement) {
        P product;
        try {
            product = factory.constructor().get();
        } catch (RuntimeException e) {
            throw new FactoryConstructionException(factory, requirement, e);
        }
        if (product == null) {
            throw new FactoryConstructionException(factory, requirement, "constructor returned null");
        }
        return product;
    }

    /**
     * Waits for a coalesced resolution, rethrowing its original failure.
     */
    static <V> V join(CompletableFuture<V> future) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return future.get();
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException re) {
                        throw re;
                    }
                    if (cause instanceof Error err) {
                        throw err;
                    }
                    throw new CompletionException(cause);
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
