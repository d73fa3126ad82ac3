package com.questrail.flightdeck.observability;

import com.questrail.flightdeck.api.Status;
import com.questrail.flightdeck.tree.ResultTree;
import com.questrail.flightdeck.tree.Testable;
import com.questrail.flightdeck.tree.TransitionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * ProgressTracker
 * =============================================================================
 * Turns a run's node transitions into one ordered event stream.
 *
 * <h2>Ordering</h2>
 * Sequence numbers are assigned and events delivered under a single lock, so
 * every subscriber sees events in sequence order, across concurrently running
 * branches. A transition reported by a thread that has observed another
 * transition (a parent finalizing after its children) always gets the higher
 * sequence number.
 *
 * <h2>Late subscribers</h2>
 * {@link #subscribe(ProgressSink)} first replays the history to the new sink,
 * then attaches it, atomically with respect to new events: no event is missed
 * or seen twice.
 *
 * <h2>Failure isolation</h2>
 * A subscriber that throws is logged and skipped for that event; it never
 * disturbs the run or other subscribers.
 *
 * <p>Delivery is synchronous on the engine's threads; slow subscribers slow
 * the run down.</p>
 */
public final class ProgressTracker implements TransitionListener
{
    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    private final String runId;
    private final Object lock = new Object();
    private final List<ProgressSink> subscribers = new CopyOnWriteArrayList<>();
    private final List<ProgressEvent> history = new ArrayList<>();
    private final List<RunErrorEvent> errors = new ArrayList<>();
    private long sequence;
    private RunCompleted completion;

    public ProgressTracker(String runId) {
        this.runId = Objects.requireNonNull(runId, "runId");
    }

    public String runId() {
        return runId;
    }

    @Override
    public void onTransition(Testable node, Status from, Status to, Instant at) {
        synchronized (lock) {
            if (completion != null) {
                log.warn("Run {} already completed; dropping transition of {} {} -> {}", runId, node.id(), from, to);
                return;
            }
            NodeTransition event = new NodeTransition(runId, ++sequence, node.id(), node.kind(), from, to, at);
            history.add(event);
            deliver(sink -> sink.onTransition(event), event);
        }
    }

    /**
     * Emits the terminal event. Only the first call has an effect.
     *
     * @return the completion event
     */
    public RunCompleted complete(ResultTree tree, Instant at) {
        synchronized (lock) {
            if (completion != null) {
                return completion;
            }
            completion = new RunCompleted(runId, ++sequence, tree, at);
            history.add(completion);
            RunCompleted event = completion;
            deliver(sink -> sink.onRunCompleted(event), event);
            return event;
        }
    }

    public void error(String message, Throwable cause, Instant at) {
        synchronized (lock) {
            RunErrorEvent event = new RunErrorEvent(runId, at, message, cause);
            errors.add(event);
            deliver(sink -> sink.onError(event), event);
        }
    }

    /**
     * Replays history to the sink and attaches it for future events.
     */
    public Subscription subscribe(ProgressSink sink) {
        Objects.requireNonNull(sink, "sink");
        synchronized (lock) {
            for (RunErrorEvent e : errors) {
                deliverSafely(sink, s -> s.onError(e), e);
            }
            for (ProgressEvent e : history) {
                if (e instanceof NodeTransition t) {
                    deliverSafely(sink, s -> s.onTransition(t), t);
                } else if (e instanceof RunCompleted c) {
                    deliverSafely(sink, s -> s.onRunCompleted(c), c);
                }
            }
            subscribers.add(sink);
        }
        log.debug("Subscribed {} to run {} after {} events", sink, runId, history.size());
        return () -> subscribers.remove(sink);
    }

    /**
     * Snapshot of every event emitted so far, in sequence order.
     */
    public List<ProgressEvent> history() {
        synchronized (lock) {
            return List.copyOf(history);
        }
    }

    public boolean isCompleted() {
        synchronized (lock) {
            return completion != null;
        }
    }

    private void deliver(Consumer<ProgressSink> action, Object event) {
        for (ProgressSink sink : subscribers) {
            deliverSafely(sink, action, event);
        }
    }

    private void deliverSafely(ProgressSink sink, Consumer<ProgressSink> action, Object event) {
        try {
            action.accept(sink);
        } catch (Exception e) {
            log.warn("Progress subscriber {} threw processing {}: {}", sink, event, e.getMessage(), e);
        }
    }
}
