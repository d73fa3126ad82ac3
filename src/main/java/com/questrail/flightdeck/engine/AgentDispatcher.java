package com.questrail.flightdeck.engine;

import com.questrail.flightdeck.api.Action;
import com.questrail.flightdeck.api.ActionOutcome;
import com.questrail.flightdeck.api.Agent;
import com.questrail.flightdeck.api.Status;
import com.questrail.flightdeck.resolve.ResolutionException;
import com.questrail.flightdeck.resolve.Resolver;
import com.questrail.flightdeck.time.Cancellable;
import com.questrail.flightdeck.time.MonotonicClock;
import com.questrail.flightdeck.time.MonotonicScheduler;
import com.questrail.flightdeck.tree.Expectations;
import com.questrail.flightdeck.tree.Result;
import com.questrail.flightdeck.tree.ResultAggregator;
import com.questrail.flightdeck.tree.Step;
import com.questrail.flightdeck.tree.StepSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * AgentDispatcher
 * =============================================================================
 * Executes one {@link Step} through its {@link Agent} and turns whatever
 * happens into the step's {@link Result}. Nothing thrown by an agent escapes
 * this boundary.
 *
 * <h2>Sequence</h2>
 * <pre>
 *   cancelled?           → SKIPPED, nothing dispatched
 *   preparation failed?  → ERROR, nothing dispatched
 *   start(step)
 *   cancelled meanwhile? → SKIPPED, nothing dispatched
 *   agent                → bound topology instance, else resolved from the
 *                          literal requirement (ResolutionException ⇒ ERROR)
 *   execute on a worker, racing three completions:
 *     agent returns outcome     → expectations applied ⇒ PASSED/FAILED/...
 *     agent throws              → ERROR (ActionExecutionException)
 *     deadline fires            → ERROR (ActionTimeoutException), agent abandoned
 *     run cancelled             → ERROR (cancellation reason), agent abandoned
 * </pre>
 *
 * <h2>Abandoning an agent</h2>
 * {@link Agent#cancel()} is requested, then the worker gets the grace period
 * to wind down before it is interrupted. The step is finalized after that
 * regardless of whether the agent ever returns.
 *
 * <h2>Time</h2>
 * Deadlines are armed on the {@link MonotonicScheduler} against the
 * {@link MonotonicClock}; no wall-clock arithmetic.
 */
final class AgentDispatcher
{
    private static final Logger log = LoggerFactory.getLogger(AgentDispatcher.class);

    static final String CANCELLED = "run cancelled";

    private final Resolver resolver;
    private final ResultAggregator aggregator;
    private final ExecutorService executor;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final CancellationToken token;
    private final RunOptions options;

    AgentDispatcher(Resolver resolver,
                    ResultAggregator aggregator,
                    ExecutorService executor,
                    MonotonicScheduler scheduler,
                    MonotonicClock clock,
                    CancellationToken token,
                    RunOptions options)
    {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.token = Objects.requireNonNull(token, "token");
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Runs the step to completion and returns its result.
     */
    Result dispatch(Step step) {
        StepSettings settings = step.settings();
        if (token.isCancelled()) {
            aggregator.skip(step, CANCELLED);
            return step.result().orElseThrow();
        }
        if (settings.preparationFailure().isPresent()) {
            Throwable failure = settings.preparationFailure().get();
            return aggregator.finalizeStep(step, Status.ERROR,
                    "preparation failed: " + failure.getMessage(), null, failure);
        }
        if (!aggregator.start(step)) {
            return step.result().orElseThrow();
        }
        if (token.isCancelled()) {
            return aggregator.finalizeStep(step, Status.SKIPPED, CANCELLED, null, null);
        }

        Agent agent;
        if (settings.boundAgent().isPresent()) {
            agent = settings.boundAgent().get();
        } else {
            try {
                agent = resolver.instance(Agent.class, settings.agentRequirement());
            } catch (ResolutionException e) {
                log.warn("Step {}: agent resolution failed: {}", step.id(), e.getMessage());
                return aggregator.finalizeStep(step, Status.ERROR,
                        "agent resolution failed: " + e.getMessage(), null, e);
            }
        }

        return execute(step, agent, settings.action(),
                settings.timeout().orElse(options.defaultStepTimeout()));
    }

    private Result execute(Step step, Agent agent, Action action, Duration timeout) {
        CompletableFuture<ActionOutcome> outcome = new CompletableFuture<>();
        Future<?> task;
        try {
            task = executor.submit(() -> {
                try {
                    outcome.complete(agent.execute(action, timeout));
                } catch (Throwable t) {
                    outcome.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            return aggregator.finalizeStep(step, Status.ERROR, "executor rejected the action",
                    null, new ActionExecutionException(step.id(), action.name(), e));
        }

        Cancellable deadline = scheduler.scheduleAfter(timeout, clock,
                () -> outcome.completeExceptionally(new ActionTimeoutException(step.id(), action.name(), timeout)));
        Cancellable onCancel = token.onCancel(
                () -> outcome.completeExceptionally(new CancellationException(CANCELLED)));
        try {
            return await(step, agent, action, outcome, task);
        } finally {
            deadline.cancel();
            onCancel.cancel();
        }
    }

    private Result await(Step step, Agent agent, Action action,
                         CompletableFuture<ActionOutcome> outcome, Future<?> task)
    {
        ActionOutcome observed;
        try {
            observed = outcome.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(step, agent, task);
            return aggregator.finalizeStep(step, Status.ERROR, "interrupted while in flight", null, e);
        } catch (ExecutionException e) {
            return failed(step, agent, action, task, e.getCause());
        }

        if (observed == null) {
            ActionExecutionException fault = new ActionExecutionException(step.id(), action.name(),
                    "agent returned no outcome");
            return aggregator.finalizeStep(step, Status.ERROR, fault.getMessage(), null, fault);
        }
        Expectations.Verdict verdict = Expectations.assess(step.settings().expected(),
                observed.status(), observed.message());
        return aggregator.finalizeStep(step, verdict.status(), verdict.message(), observed, null);
    }

    private Result failed(Step step, Agent agent, Action action, Future<?> task, Throwable cause) {
        if (cause instanceof ActionTimeoutException timeout) {
            log.warn("Step {}: {}", step.id(), timeout.getMessage());
            abandon(step, agent, task);
            return aggregator.finalizeStep(step, Status.ERROR, timeout.getMessage(), null, timeout);
        }
        if (cause instanceof CancellationException cancelled) {
            log.info("Step {}: cancelled while in flight", step.id());
            abandon(step, agent, task);
            return aggregator.finalizeStep(step, Status.ERROR,
                    "cancelled while in flight: " + CANCELLED, null, cancelled);
        }
        ActionExecutionException fault = new ActionExecutionException(step.id(), action.name(), cause);
        log.warn("Step {}: {}", step.id(), fault.getMessage());
        return aggregator.finalizeStep(step, Status.ERROR, fault.getMessage(), null, fault);
    }

    private void abandon(Step step, Agent agent, Future<?> task) {
        try {
            agent.cancel();
        } catch (RuntimeException e) {
            log.warn("Step {}: agent cancel() failed: {}", step.id(), e.getMessage(), e);
        }
        try {
            task.get(options.cancellationGracePeriod().toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            log.warn("Step {}: agent did not respond to cancel within {} ms; interrupting",
                    step.id(), options.cancellationGracePeriod().toMillis());
            task.cancel(true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel(true);
        } catch (ExecutionException | CancellationException e) {
            log.debug("Step {}: abandoned execution ended with {}", step.id(), e.toString());
        }
    }
}
