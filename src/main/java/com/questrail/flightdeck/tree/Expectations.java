package com.questrail.flightdeck.tree;

import com.questrail.flightdeck.api.Status;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Expectations
 * -----------------------------------------------------------------------------
 * Rewrites an agent-reported status against the statuses a step expects.
 *
 * <pre>
 *   expected = {PASSED}      → status stands as reported
 *   expected = {X}, X≠PASSED → actual == X ? PASSED "actual A == expected X: m"
 *                                          : FAILED "actual A != expected X: m"
 *   expected = {X, Y, ...}   → actual ∈ set ? PASSED "actual A in expected [..]: m"
 *                                           : FAILED "actual A not in expected [..]: m"
 * </pre>
 *
 * An expected {@code FAILED} or {@code SKIPPED} therefore reports a match as a
 * pass, so a negative test does not drag its container down.
 */
public final class Expectations
{
    /**
     * Outcome of an assessment.
     */
    public record Verdict(Status status, String message) {}

    private Expectations() {
    }

    public static Verdict assess(Set<Status> expected, Status actual, String message) {
        String detail = message == null ? "" : message;
        if (expected.size() == 1) {
            Status only = expected.iterator().next();
            if (only == Status.PASSED) {
                return new Verdict(actual, detail);
            }
            if (actual == only) {
                return new Verdict(Status.PASSED, "actual " + actual + " == expected " + only + suffix(detail));
            }
            return new Verdict(Status.FAILED, "actual " + actual + " != expected " + only + suffix(detail));
        }

        List<String> names = expected.stream().sorted().map(Enum::name).collect(Collectors.toList());
        if (expected.contains(actual)) {
            return new Verdict(Status.PASSED, "actual " + actual + " in expected " + names + suffix(detail));
        }
        return new Verdict(Status.FAILED, "actual " + actual + " not in expected " + names + suffix(detail));
    }

    private static String suffix(String detail) {
        return detail.isEmpty() ? "" : ": " + detail;
    }
}
