package com.questrail.flightdeck.tree;

import com.questrail.flightdeck.api.Status;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AggregationTest {

    @Test
    void emptyContainerPasses() {
        assertEquals(Status.PASSED, Aggregation.reduce(List.of()));
    }

    @Test
    void higherPrecedenceDominates() {
        assertEquals(Status.PASSED, Aggregation.reduce(List.of(Status.PASSED, Status.PASSED)));
        assertEquals(Status.SKIPPED, Aggregation.reduce(List.of(Status.PASSED, Status.SKIPPED)));
        assertEquals(Status.FAILED, Aggregation.reduce(List.of(Status.SKIPPED, Status.FAILED, Status.PASSED)));
        assertEquals(Status.ERROR, Aggregation.reduce(List.of(Status.FAILED, Status.ERROR, Status.SKIPPED)));
    }

    @Test
    void orderDoesNotMatter() {
        assertEquals(Aggregation.reduce(List.of(Status.ERROR, Status.PASSED)),
                Aggregation.reduce(List.of(Status.PASSED, Status.ERROR)));
    }

    @Test
    void nonTerminalStatusesCannotBeAggregated() {
        assertThrows(IllegalArgumentException.class, () -> Aggregation.reduce(List.of(Status.PASSED, Status.RUNNING)));
        assertThrows(IllegalArgumentException.class, () -> Aggregation.reduce(List.of(Status.PENDING)));
    }
}
