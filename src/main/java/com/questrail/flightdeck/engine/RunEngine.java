package com.questrail.flightdeck.engine;

import com.questrail.flightdeck.observability.NullProgressSink;
import com.questrail.flightdeck.observability.ProgressSink;
import com.questrail.flightdeck.observability.ProgressTracker;
import com.questrail.flightdeck.plan.SuiteDefinition;
import com.questrail.flightdeck.resolve.FactoryRegistry;
import com.questrail.flightdeck.resolve.ResolutionException;
import com.questrail.flightdeck.resolve.Resolver;
import com.questrail.flightdeck.resolve.Topology;
import com.questrail.flightdeck.time.MonotonicClock;
import com.questrail.flightdeck.time.MonotonicScheduler;
import com.questrail.flightdeck.time.SystemMonotonicClock;
import com.questrail.flightdeck.time.SystemWallClock;
import com.questrail.flightdeck.time.WallClock;
import com.questrail.flightdeck.time.WheelTimerScheduler;
import com.questrail.flightdeck.tree.AggregationInvariantViolationException;
import com.questrail.flightdeck.tree.ResultAggregator;
import com.questrail.flightdeck.tree.ResultTree;
import com.questrail.flightdeck.tree.Suite;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * RunEngine
 * =============================================================================
 * Entry point: accepts runs and drives them to completion.
 *
 * <h2>A run</h2>
 * <pre>
 *   submit(topology, plan, options)
 *     → freeze registry, new Resolver (per-run cache)
 *     → PlanAssembler: resolve topology and abstract actions, build the tree
 *     → TreeExecutor + AgentDispatcher: execute, aggregate, stream progress
 *     → Resolver.close(): release run-scoped agents
 *     → RunCompleted(tree)      or   RunAbortedException via RunHandle.await()
 * </pre>
 * {@link #submit} returns immediately; the run proceeds on the engine's
 * executor.
 *
 * <h2>Ownership</h2>
 * Components created by the builder's defaults (worker pool, deadline wheel)
 * are owned and shut down by {@link #close()}. Supplied components are not.
 * A supplied executor must not bound its thread count below what nested
 * parallel suites need: containers wait on their children from pool threads.
 */
public final class RunEngine implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(RunEngine.class);

    private final FactoryRegistry registry;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final MonotonicScheduler scheduler;
    private final ProgressSink sink;
    private final ExecutorService executor;
    private final boolean ownsScheduler;
    private final boolean ownsExecutor;
    private final AtomicLong runCounter = new AtomicLong();

    private RunEngine(Builder b) {
        this.registry = Objects.requireNonNull(b.registry, "registry");
        this.clock = b.clock;
        this.wallClock = b.wallClock;
        this.sink = b.sink;
        this.ownsScheduler = b.scheduler == null;
        this.scheduler = ownsScheduler ? new WheelTimerScheduler(clock, Duration.ofMillis(10)) : b.scheduler;
        this.ownsExecutor = b.executor == null;
        this.executor = ownsExecutor
                ? Executors.newCachedThreadPool(new DefaultThreadFactory("flightdeck-worker", true))
                : b.executor;
    }

    public static Builder builder(FactoryRegistry registry) {
        return new Builder(registry);
    }

    public RunHandle submit(Topology topology, SuiteDefinition plan) {
        return submit(topology, plan, RunOptions.defaults());
    }

    /**
     * Starts a run.
     *
     * @throws RejectedExecutionException if the engine is closed
     */
    public RunHandle submit(Topology topology, SuiteDefinition plan, RunOptions options) {
        Objects.requireNonNull(topology, "topology");
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(options, "options");

        String runId = "run-" + runCounter.incrementAndGet();
        ProgressTracker tracker = new ProgressTracker(runId);
        tracker.subscribe(sink);
        CancellationToken token = new CancellationToken();
        RunHandle handle = new RunHandle(runId, tracker, token);

        executor.execute(() -> execute(handle, tracker, token, topology, plan, options));
        log.info("Submitted {} for plan '{}'", runId, plan.name());
        return handle;
    }

    private void execute(RunHandle handle, ProgressTracker tracker, CancellationToken token,
                         Topology topology, SuiteDefinition plan, RunOptions options)
    {
        String runId = handle.runId();
        ResultAggregator aggregator = new ResultAggregator(wallClock, tracker, options.strictFinalization());
        try (Resolver resolver = new Resolver(registry)) {
            Suite root;
            try {
                root = new PlanAssembler(resolver, options).assemble(topology, plan);
            } catch (ResolutionException | IllegalArgumentException e) {
                abort(handle, tracker, "preparation failed: " + e.getMessage(), e);
                return;
            }
            handle.attach(root);

            AgentDispatcher dispatcher = new AgentDispatcher(resolver, aggregator, executor, scheduler,
                    clock, token, options);
            new TreeExecutor(aggregator, dispatcher, executor, token, options).run(root);

            ResultTree tree = ResultTree.of(root);
            tracker.complete(tree, wallClock.now());
            handle.complete(tree);
            log.info("{} finished: {}", runId, tree.status());
        } catch (AggregationInvariantViolationException e) {
            abort(handle, tracker, "aggregation invariant violated: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            abort(handle, tracker, "unexpected engine failure: " + e, e);
        } catch (Error e) {
            abort(handle, tracker, "fatal error: " + e, e);
            throw e;
        }
    }

    private void abort(RunHandle handle, ProgressTracker tracker, String message, Throwable cause) {
        log.error("{} aborted: {}", handle.runId(), message, cause);
        tracker.error(message, cause, wallClock.now());
        handle.abort(new RunAbortedException(handle.runId(), message, cause));
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
        if (ownsScheduler && scheduler instanceof WheelTimerScheduler wheel) {
            wheel.close();
        }
    }

    public static final class Builder
    {
        private final FactoryRegistry registry;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private ProgressSink sink = NullProgressSink.INSTANCE;
        private ExecutorService executor;

        private Builder(FactoryRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry");
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
            return this;
        }

        /**
         * Scheduler for step deadlines; must share the engine's monotonic clock.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
            return this;
        }

        /**
         * Sink attached to every run before it starts.
         */
        public Builder withProgressSink(ProgressSink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public Builder withExecutor(ExecutorService executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        public RunEngine build() {
            return new RunEngine(this);
        }
    }
}
