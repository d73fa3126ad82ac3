package com.questrail.flightdeck.engine;

import com.questrail.flightdeck.api.FailureResponse;
import com.questrail.flightdeck.api.Status;
import com.questrail.flightdeck.tree.Case;
import com.questrail.flightdeck.tree.CaseLifecycle;
import com.questrail.flightdeck.tree.ExecutionPolicy;
import com.questrail.flightdeck.tree.Flight;
import com.questrail.flightdeck.tree.Result;
import com.questrail.flightdeck.tree.ResultAggregator;
import com.questrail.flightdeck.tree.Step;
import com.questrail.flightdeck.tree.Suite;
import com.questrail.flightdeck.tree.SuiteMember;
import com.questrail.flightdeck.tree.Testable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.function.Consumer;

/**
 * TreeExecutor
 * =============================================================================
 * Walks a live tree, applying the execution policy of each node kind.
 *
 * <h2>Policies</h2>
 * <pre>
 *   Suite  → members per the suite's policy (default parallel); every Case
 *            holds one of {@code workerLimit} run-wide permits while running
 *   Case   → prepare, flights per the case's policy (default sequential),
 *            audit (unless cancelled), restore (always)
 *   Flight → steps in declaration order; consecutive independent steps are
 *            dispatched together and joined before the next step starts
 * </pre>
 *
 * <h2>Failure response</h2>
 * After a {@code FAILED} or {@code ERROR} step whose response is
 * {@link FailureResponse#CONCLUDE}, the remaining steps of the flight are
 * skipped.
 *
 * <h2>Cancellation</h2>
 * Every node checks the run's {@link CancellationToken} before starting; once
 * set, nothing new starts and every not-yet-started node is skipped. Running
 * containers still finalize from their children.
 *
 * <h2>Errors</h2>
 * Step faults never reach this class; they are results. Anything that does
 * propagate (an invariant violation, or an {@link Error} such as a missing
 * agent class) is rethrown to the engine once every branch already dispatched
 * has finished.
 */
final class TreeExecutor
{
    private static final Logger log = LoggerFactory.getLogger(TreeExecutor.class);

    private final ResultAggregator aggregator;
    private final AgentDispatcher dispatcher;
    private final ExecutorService executor;
    private final CancellationToken token;
    private final RunOptions options;
    private final Semaphore casePermits;

    TreeExecutor(ResultAggregator aggregator,
                 AgentDispatcher dispatcher,
                 ExecutorService executor,
                 CancellationToken token,
                 RunOptions options)
    {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.token = Objects.requireNonNull(token, "token");
        this.options = Objects.requireNonNull(options, "options");
        this.casePermits = new Semaphore(options.workerLimit());
    }

    /**
     * Executes the tree; on return every node is finalized.
     */
    void run(Suite root) {
        runSuite(root);
    }

    private void runSuite(Suite suite) {
        if (skipIfCancelled(suite)) {
            return;
        }
        aggregator.start(suite);
        runChildren(suite.members(), suite.policy(), this::runMember);
        aggregator.finalizeContainer(suite);
    }

    private void runMember(SuiteMember member) {
        if (member instanceof Suite nested) {
            runSuite(nested);
            return;
        }
        casePermits.acquireUninterruptibly();
        try {
            runCase((Case) member);
        } finally {
            casePermits.release();
        }
    }

    private void runCase(Case testCase) {
        if (skipIfCancelled(testCase)) {
            return;
        }
        aggregator.start(testCase);
        CaseLifecycle lifecycle = testCase.lifecycle();

        PhaseFailure failure = phase(testCase, "prepare", () -> lifecycle.prepare(testCase));
        if (failure == null) {
            runChildren(testCase.flights(), testCase.policy(), this::runFlight);
            if (!token.isCancelled()) {
                failure = phase(testCase, "audit", () -> lifecycle.audit(testCase));
            }
        } else {
            for (Flight flight : testCase.flights()) {
                aggregator.skip(flight, "prepare failed");
            }
        }
        PhaseFailure restore = phase(testCase, "restore", () -> lifecycle.restore(testCase));
        if (failure == null) {
            failure = restore;
        } else if (restore != null) {
            failure.cause().addSuppressed(restore.cause());
        }

        if (failure == null) {
            aggregator.finalizeContainer(testCase);
        } else {
            aggregator.finalizeContainer(testCase, Status.ERROR, failure.message(), failure.cause());
        }
    }

    private void runFlight(Flight flight) {
        if (skipIfCancelled(flight)) {
            return;
        }
        aggregator.start(flight);
        List<Step> steps = flight.steps();
        String skipReason = null;
        int i = 0;
        while (i < steps.size()) {
            if (token.isCancelled()) {
                skipReason = AgentDispatcher.CANCELLED;
                break;
            }
            int end = i + 1;
            if (steps.get(i).settings().independent()) {
                while (end < steps.size() && steps.get(end).settings().independent()) {
                    end++;
                }
            }
            List<Step> group = steps.subList(i, end);
            List<Result> results = dispatchGroup(group);

            Step concluding = null;
            for (int k = 0; k < group.size(); k++) {
                if (results.get(k).status().isBad() && responseOf(group.get(k)) == FailureResponse.CONCLUDE) {
                    concluding = group.get(k);
                    break;
                }
            }
            i = end;
            if (concluding != null) {
                skipReason = "concluded after " + concluding.name() + " " + concluding.status();
                log.info("Flight {} {}", flight.id(), skipReason);
                break;
            }
        }
        for (int k = i; k < steps.size(); k++) {
            aggregator.skip(steps.get(k), skipReason);
        }
        aggregator.finalizeContainer(flight);
    }

    private List<Result> dispatchGroup(List<Step> group) {
        if (group.size() == 1) {
            return List.of(dispatcher.dispatch(group.get(0)));
        }
        List<CompletableFuture<Result>> futures = new ArrayList<>();
        for (Step step : group) {
            futures.add(CompletableFuture.supplyAsync(() -> dispatcher.dispatch(step), executor));
        }
        joinAll(futures);
        List<Result> results = new ArrayList<>();
        for (CompletableFuture<Result> f : futures) {
            results.add(f.join());
        }
        return results;
    }

    private FailureResponse responseOf(Step step) {
        return step.settings().failureResponse().orElse(options.defaultFailureResponse());
    }

    private <N extends Testable> void runChildren(List<N> children, ExecutionPolicy policy,
                                                  Consumer<N> body)
    {
        if (!policy.isParallel() || children.size() < 2) {
            children.forEach(body);
            return;
        }
        Semaphore slots = new Semaphore(policy.effectiveConcurrency(options.workerLimit()));
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (N child : children) {
            slots.acquireUninterruptibly();
            try {
                futures.add(CompletableFuture.runAsync(() -> {
                    try {
                        body.accept(child);
                    } finally {
                        slots.release();
                    }
                }, executor));
            } catch (RuntimeException e) {
                slots.release();
                joinAll(futures);
                throw e;
            }
        }
        joinAll(futures);
    }

    /**
     * Waits for every future, then rethrows the first failure, if any.
     */
    private static void joinAll(List<? extends CompletableFuture<?>> futures) {
        Throwable first = null;
        for (CompletableFuture<?> f : futures) {
            try {
                f.join();
            } catch (CompletionException e) {
                if (first == null) {
                    first = e.getCause() != null ? e.getCause() : e;
                }
            }
        }
        if (first instanceof Error error) {
            throw error;
        }
        if (first instanceof RuntimeException re) {
            throw re;
        }
        if (first != null) {
            throw new CompletionException(first);
        }
    }

    private boolean skipIfCancelled(Testable node) {
        if (token.isCancelled()) {
            aggregator.skip(node, AgentDispatcher.CANCELLED);
            return true;
        }
        return false;
    }

    @FunctionalInterface
    private interface Phase
    {
        void run() throws Exception;
    }

    private record PhaseFailure(String message, Throwable cause) {}

    private PhaseFailure phase(Case testCase, String name, Phase phase) {
        try {
            phase.run();
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new PhaseFailure(name + " interrupted", e);
        } catch (Exception e) {
            log.warn("Case {}: {} failed: {}", testCase.id(), name, e.getMessage(), e);
            return new PhaseFailure(name + " failed: " + e.getMessage(), e);
        }
    }
}
