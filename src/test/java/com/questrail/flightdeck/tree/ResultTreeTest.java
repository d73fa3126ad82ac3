package com.questrail.flightdeck.tree;

import com.questrail.flightdeck.api.NodeKind;
import com.questrail.flightdeck.api.Status;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.questrail.flightdeck.tree.TestableTest.settings;
import static org.junit.jupiter.api.Assertions.*;

class ResultTreeTest {

    private final ResultAggregator aggregator = new ResultAggregator(Instant::now, TransitionListener.NONE, true);

    @Test
    void snapshotsAFinalizedTree() {
        Suite root = Suite.root("root");
        Case c = root.addCase("case");
        Flight f = c.addFlight("flight");
        Step a = f.addStep("a", settings("a"));
        Step b = f.addStep("b", settings("b"));

        aggregator.start(root);
        aggregator.start(c);
        aggregator.start(f);
        aggregator.start(a);
        aggregator.finalizeStep(a, Status.PASSED, "", null, null);
        aggregator.skip(f, "concluded");
        aggregator.finalizeContainer(c);
        aggregator.finalizeContainer(root);

        ResultTree tree = ResultTree.of(root);

        assertEquals(Status.SKIPPED, tree.status());
        assertEquals(5, tree.size());
        assertEquals(List.of("root", "root/case", "root/case/flight", "root/case/flight/a", "root/case/flight/b"),
                tree.stream().map(n -> n.id().path()).toList());
        assertEquals(Status.SKIPPED, tree.find("root/case/flight/b").orElseThrow().status());
        assertEquals(Map.of(Status.PASSED, 1, Status.SKIPPED, 1), tree.tally(NodeKind.STEP));
        assertTrue(tree.find("root/nope").isEmpty());
        assertSame(b, tree.find(b.id()).orElseThrow().result().source());
    }

    @Test
    void unfinalizedTreesCannotBeSnapshot() {
        Suite root = Suite.root("root");
        root.addCase("case");
        aggregator.start(root);
        assertThrows(IllegalStateException.class, () -> ResultTree.of(root));
    }
}
