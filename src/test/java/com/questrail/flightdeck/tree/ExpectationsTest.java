package com.questrail.flightdeck.tree;

import com.questrail.flightdeck.api.Status;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExpectationsTest {

    @Test
    void defaultExpectationPassesStatusThrough() {
        Expectations.Verdict v = Expectations.assess(Set.of(Status.PASSED), Status.FAILED, "HTTP 500");
        assertEquals(Status.FAILED, v.status());
        assertEquals("HTTP 500", v.message());
    }

    @Test
    void expectedFailureThatFailsPasses() {
        Expectations.Verdict v = Expectations.assess(Set.of(Status.FAILED), Status.FAILED, "login rejected");
        assertEquals(Status.PASSED, v.status());
        assertEquals("actual FAILED == expected FAILED: login rejected", v.message());
    }

    @Test
    void expectedFailureThatPassesFails() {
        Expectations.Verdict v = Expectations.assess(Set.of(Status.FAILED), Status.PASSED, "");
        assertEquals(Status.FAILED, v.status());
        assertEquals("actual PASSED != expected FAILED", v.message());
    }

    @Test
    void setOfExpectedStatuses() {
        Set<Status> expected = EnumSet.of(Status.SKIPPED, Status.FAILED);

        Expectations.Verdict in = Expectations.assess(expected, Status.SKIPPED, "not supported");
        assertEquals(Status.PASSED, in.status());
        assertEquals("actual SKIPPED in expected [SKIPPED, FAILED]: not supported", in.message());

        Expectations.Verdict out = Expectations.assess(expected, Status.ERROR, null);
        assertEquals(Status.FAILED, out.status());
        assertEquals("actual ERROR not in expected [SKIPPED, FAILED]", out.message());
    }
}
