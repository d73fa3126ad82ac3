package com.questrail.flightdeck.observability;

import com.questrail.flightdeck.api.Status;
import com.questrail.flightdeck.tree.ResultAggregator;
import com.questrail.flightdeck.tree.ResultTree;
import com.questrail.flightdeck.tree.Suite;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProgressTrackerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void transitionsAreNumberedInOrder() {
        ProgressTracker tracker = new ProgressTracker("run-1");
        RecordingProgressSink sink = new RecordingProgressSink();
        tracker.subscribe(sink);

        Suite root = Suite.root("root");
        ResultAggregator aggregator = new ResultAggregator(() -> T0, tracker, true);
        aggregator.start(root);
        aggregator.finalizeContainer(root);
        RunCompleted done = tracker.complete(ResultTree.of(root), T0);

        List<NodeTransition> transitions = sink.getTransitions();
        assertEquals(2, transitions.size());
        assertEquals(1, transitions.get(0).sequence());
        assertEquals(Status.RUNNING, transitions.get(0).to());
        assertEquals(2, transitions.get(1).sequence());
        assertTrue(transitions.get(1).isFinalization());
        assertEquals(3, done.sequence());
        assertEquals(Status.PASSED, done.status());
        assertSame(done, sink.getAllEvents().get(2));
        assertEquals("run-1", done.runId());
    }

    @Test
    void lateSubscriberReceivesReplayThenLiveEvents() {
        ProgressTracker tracker = new ProgressTracker("run-1");
        Suite root = Suite.root("root");
        ResultAggregator aggregator = new ResultAggregator(() -> T0, tracker, true);
        aggregator.start(root);

        RecordingProgressSink late = new RecordingProgressSink();
        tracker.subscribe(late);
        aggregator.finalizeContainer(root);

        assertEquals(List.of(1L, 2L), late.getTransitions().stream().map(NodeTransition::sequence).toList());
    }

    @Test
    void throwingSubscriberDoesNotDisturbOthers() {
        ProgressTracker tracker = new ProgressTracker("run-1");
        tracker.subscribe(new ProgressSink() {
            @Override
            public void onTransition(NodeTransition event) {
                throw new IllegalStateException("boom");
            }

            @Override
            public void onRunCompleted(RunCompleted event) {
                throw new IllegalStateException("boom");
            }

            @Override
            public void onError(RunErrorEvent event) {
            }
        });
        RecordingProgressSink healthy = new RecordingProgressSink();
        tracker.subscribe(healthy);

        Suite root = Suite.root("root");
        ResultAggregator aggregator = new ResultAggregator(() -> T0, tracker, true);
        aggregator.start(root);
        aggregator.finalizeContainer(root);
        tracker.complete(ResultTree.of(root), T0);

        assertEquals(3, healthy.getAllEvents().size());
    }

    @Test
    void completionHappensOnceAndStopsTheStream() {
        ProgressTracker tracker = new ProgressTracker("run-1");
        Suite root = Suite.root("root");
        ResultAggregator aggregator = new ResultAggregator(() -> T0, tracker, false);
        aggregator.start(root);
        aggregator.finalizeContainer(root);
        ResultTree tree = ResultTree.of(root);

        RunCompleted first = tracker.complete(tree, T0);
        RunCompleted second = tracker.complete(tree, T0.plusSeconds(1));
        tracker.onTransition(root, Status.PASSED, Status.ERROR, T0);

        assertSame(first, second);
        assertTrue(tracker.isCompleted());
        assertEquals(3, tracker.history().size());
        assertInstanceOf(RunCompleted.class, tracker.history().get(2));
    }

    @Test
    void unsubscribedSinkStopsReceiving() {
        ProgressTracker tracker = new ProgressTracker("run-1");
        RecordingProgressSink sink = new RecordingProgressSink();
        Subscription subscription = tracker.subscribe(sink);
        subscription.unsubscribe();

        tracker.error("preparation failed", new IllegalStateException(), T0);

        assertTrue(sink.getAllEvents().isEmpty());
        RecordingProgressSink late = new RecordingProgressSink();
        tracker.subscribe(late);
        assertTrue(late.hasEventOfType(RunErrorEvent.class));
    }

    @Test
    void concurrentTransitionsArriveInSequenceOrder() throws Exception {
        ProgressTracker tracker = new ProgressTracker("run-1");
        List<Long> seen = new ArrayList<>();
        tracker.subscribe(new ProgressSink() {
            @Override
            public void onTransition(NodeTransition event) {
                seen.add(event.sequence());
            }

            @Override
            public void onRunCompleted(RunCompleted event) {
            }

            @Override
            public void onError(RunErrorEvent event) {
            }
        });

        Suite root = Suite.root("root");
        List<Suite> children = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            children.add(root.addSuite("child" + i, root.policy()));
        }
        ResultAggregator aggregator = new ResultAggregator(() -> T0, tracker, true);
        aggregator.start(root);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(children.size());
        for (Suite child : children) {
            pool.execute(() -> {
                aggregator.start(child);
                aggregator.finalizeContainer(child);
                done.countDown();
            });
        }
        assertTrue(done.await(5, TimeUnit.SECONDS));
        pool.shutdown();

        assertEquals(33, seen.size());
        for (int i = 0; i < seen.size(); i++) {
            assertEquals((long) (i + 1), seen.get(i).longValue());
        }
    }
}
