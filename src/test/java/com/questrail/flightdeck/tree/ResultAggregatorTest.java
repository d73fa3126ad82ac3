package com.questrail.flightdeck.tree;

import com.questrail.flightdeck.api.ActionOutcome;
import com.questrail.flightdeck.api.NodeId;
import com.questrail.flightdeck.api.Status;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.questrail.flightdeck.tree.TestableTest.settings;
import static org.junit.jupiter.api.Assertions.*;

class ResultAggregatorTest {

    private final List<String> transitions = new ArrayList<>();
    private Instant now;
    private ResultAggregator aggregator;

    private Suite root;
    private Case testCase;
    private Flight flight;
    private Step first;
    private Step second;

    @BeforeEach
    void setUp() {
        now = Instant.parse("2024-01-01T00:00:00Z");
        aggregator = aggregator(true);
        root = Suite.root("root");
        testCase = root.addCase("case");
        flight = testCase.addFlight("flight");
        first = flight.addStep("first", settings("a"));
        second = flight.addStep("second", settings("b"));
    }

    private ResultAggregator aggregator(boolean strict) {
        return new ResultAggregator(() -> now,
                (node, from, to, at) -> transitions.add(node.name() + ":" + from + "->" + to), strict);
    }

    private void startAll() {
        aggregator.start(root);
        aggregator.start(testCase);
        aggregator.start(flight);
    }

    @Test
    void resultsPropagateToTheRoot() {
        startAll();
        aggregator.start(first);
        now = now.plusSeconds(2);
        Result r = aggregator.finalizeStep(first, Status.PASSED, "ok", ActionOutcome.passed("ok"), null);
        assertEquals(2, r.duration().toSeconds());
        assertEquals("ok", r.outcome().orElseThrow().message());

        aggregator.start(second);
        aggregator.finalizeStep(second, Status.FAILED, "HTTP 500", null, null);
        aggregator.finalizeContainer(flight);
        aggregator.finalizeContainer(testCase);
        Result top = aggregator.finalizeContainer(root);

        assertEquals(Status.FAILED, top.status());
        assertEquals("HTTP 500", top.message());
        assertEquals(Status.FAILED, flight.status());
        assertEquals(List.of(
                "root:PENDING->RUNNING", "case:PENDING->RUNNING", "flight:PENDING->RUNNING",
                "first:PENDING->RUNNING", "first:RUNNING->PASSED",
                "second:PENDING->RUNNING", "second:RUNNING->FAILED",
                "flight:RUNNING->FAILED", "case:RUNNING->FAILED", "root:RUNNING->FAILED"), transitions);
    }

    @Test
    void containerMessageComesFromFirstDominantChildInDeclarationOrder() {
        startAll();
        aggregator.start(second);
        aggregator.finalizeStep(second, Status.ERROR, "second broke", null, null);
        aggregator.start(first);
        aggregator.finalizeStep(first, Status.ERROR, "first broke", null, null);

        assertEquals("first broke", aggregator.finalizeContainer(flight).message());
    }

    @Test
    void finalizingAContainerEarlyIsAViolation() {
        startAll();
        aggregator.start(first);
        aggregator.finalizeStep(first, Status.PASSED, "", null, null);

        AggregationInvariantViolationException e = assertThrows(AggregationInvariantViolationException.class,
                () -> aggregator.finalizeContainer(flight));
        assertEquals(flight.id(), e.snapshot().id());
        assertEquals(Status.RUNNING, e.snapshot().status());
        assertFalse(flight.isFinalized());
    }

    @Test
    void startingTwiceIsAViolation() {
        aggregator.start(root);
        assertThrows(AggregationInvariantViolationException.class, () -> aggregator.start(root));
    }

    @Test
    void strictModeRejectsRefinalization() {
        startAll();
        aggregator.start(first);
        aggregator.finalizeStep(first, Status.PASSED, "", null, null);
        assertThrows(AggregationInvariantViolationException.class,
                () -> aggregator.finalizeStep(first, Status.FAILED, "", null, null));
        assertEquals(Status.PASSED, first.status());
    }

    @Test
    void lenientModeIgnoresRefinalization() {
        aggregator = aggregator(false);
        startAll();
        aggregator.start(first);
        Result original = aggregator.finalizeStep(first, Status.PASSED, "", null, null);

        Result again = aggregator.finalizeStep(first, Status.ERROR, "late", null, null);

        assertSame(original, again);
        assertEquals(Status.PASSED, first.status());
        assertFalse(aggregator.start(first));
    }

    @Test
    void skipFinalizesAPendingSubtreeLeavesFirst() {
        aggregator.start(root);
        aggregator.skip(testCase, "run cancelled");

        assertEquals(Status.SKIPPED, first.status());
        assertEquals(Status.SKIPPED, second.status());
        assertEquals(Status.SKIPPED, flight.status());
        assertEquals("run cancelled", testCase.result().orElseThrow().message());
        assertEquals(List.of("root:PENDING->RUNNING",
                "first:PENDING->SKIPPED", "second:PENDING->SKIPPED",
                "flight:PENDING->SKIPPED", "case:PENDING->SKIPPED"), transitions);
    }

    @Test
    void skipAggregatesARunningContainerNormally() {
        startAll();
        aggregator.start(first);
        aggregator.finalizeStep(first, Status.FAILED, "bad", null, null);

        aggregator.skip(flight, "concluded");

        assertEquals(Status.SKIPPED, second.status());
        assertEquals(Status.FAILED, flight.status());
    }

    @Test
    void skippingARunningStepIsAViolation() {
        startAll();
        aggregator.start(first);
        assertThrows(AggregationInvariantViolationException.class, () -> aggregator.skip(flight, "x"));
    }

    @Test
    void floorOverridesMilderChildren() {
        startAll();
        aggregator.skip(flight, "prepare failed");
        IllegalStateException cause = new IllegalStateException("db down");

        Result r = aggregator.finalizeContainer(testCase, Status.ERROR, "prepare failed: db down", cause);

        assertEquals(Status.ERROR, r.status());
        assertEquals("prepare failed: db down", r.message());
        assertSame(cause, r.failure().orElseThrow());
    }

    @Test
    void provisionalStatusReflectsChildrenSoFar() {
        startAll();
        assertEquals(Status.RUNNING, aggregator.provisionalStatus(flight));
        aggregator.start(first);
        aggregator.finalizeStep(first, Status.SKIPPED, "", null, null);
        assertEquals(Status.SKIPPED, aggregator.provisionalStatus(flight));
        assertFalse(flight.isFinalized());
    }

    @Test
    void emptyContainerPasses() {
        Suite empty = Suite.root("empty");
        aggregator.start(empty);
        assertEquals(Status.PASSED, aggregator.finalizeContainer(empty).status());
        assertEquals(new NodeId("empty"), empty.id());
    }
}
