package com.questrail.flightdeck.engine;

import com.questrail.flightdeck.observability.ProgressEvent;
import com.questrail.flightdeck.observability.ProgressSink;
import com.questrail.flightdeck.observability.ProgressTracker;
import com.questrail.flightdeck.observability.Subscription;
import com.questrail.flightdeck.tree.ResultTree;
import com.questrail.flightdeck.tree.Suite;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * RunHandle
 * -----------------------------------------------------------------------------
 * Caller's view of a submitted run.
 *
 * <pre>
 *   RunHandle run = engine.submit(topology, plan, options);
 *   run.subscribe(reporter);      // replays what already happened
 *   ResultTree tree = run.await();
 * </pre>
 *
 * {@link #await()} returns the final result tree, or throws
 * {@link RunAbortedException} when the run could not be prepared or hit an
 * internal invariant violation.
 */
public final class RunHandle
{
    private final String runId;
    private final ProgressTracker tracker;
    private final CancellationToken token;
    private final CompletableFuture<ResultTree> completion = new CompletableFuture<>();
    private volatile Suite root;

    RunHandle(String runId, ProgressTracker tracker, CancellationToken token) {
        this.runId = runId;
        this.tracker = tracker;
        this.token = token;
    }

    public String runId() {
        return runId;
    }

    /**
     * Requests cancellation: nothing new starts, in-flight agents are asked to
     * cancel. Idempotent.
     *
     * @return {@code true} if this call cancelled the run
     */
    public boolean cancel() {
        return token.cancel();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    public boolean isDone() {
        return completion.isDone();
    }

    /**
     * Waits for the run to finish.
     *
     * @throws RunAbortedException  if the run aborted
     * @throws InterruptedException if the caller is interrupted while waiting
     */
    public ResultTree await() throws InterruptedException {
        try {
            return completion.get();
        } catch (ExecutionException e) {
            throw aborted(e);
        }
    }

    /**
     * Waits at most {@code timeout} for the run to finish.
     *
     * @throws TimeoutException if the run is still going
     */
    public ResultTree await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return completion.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw aborted(e);
        }
    }

    /**
     * Subscribes to progress; events emitted before the call are replayed first.
     */
    public Subscription subscribe(ProgressSink sink) {
        return tracker.subscribe(sink);
    }

    public List<ProgressEvent> history() {
        return tracker.history();
    }

    /**
     * The live tree, once the run has been assembled.
     */
    public Optional<Suite> root() {
        return Optional.ofNullable(root);
    }

    void attach(Suite root) {
        this.root = root;
    }

    void complete(ResultTree tree) {
        completion.complete(tree);
    }

    void abort(RunAbortedException e) {
        completion.completeExceptionally(e);
    }

    private RunAbortedException aborted(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RunAbortedException rae) {
            return rae;
        }
        return new RunAbortedException(runId, String.valueOf(cause), cause);
    }

    @Override
    public String toString() {
        return "RunHandle[" + runId + (isDone() ? ", done" : "") + (isCancelled() ? ", cancelled" : "") + "]";
    }
}
