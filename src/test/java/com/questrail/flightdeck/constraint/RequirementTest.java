package com.questrail.flightdeck.constraint;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RequirementTest {

    @Test
    void parsesEveryOperator() {
        Requirement r = Requirement.parse("interface=REST, os=linux|mac, env!=prod, version>=2.3, version<3");

        assertEquals(List.of("env", "interface", "os", "version"), List.copyOf(r.attributes()));
        assertInstanceOf(Constraint.Equals.class, r.constraint("interface").orElseThrow());
        assertInstanceOf(Constraint.OneOf.class, r.constraint("os").orElseThrow());
        assertInstanceOf(Constraint.Excludes.class, r.constraint("env").orElseThrow());
        assertEquals(" in [2.3,3)", r.constraint("version").orElseThrow().canonicalPredicate());
    }

    @Test
    void signatureIsCanonical() {
        Requirement a = Requirement.parse("version>=2.3, interface==REST, os=mac|linux");
        Requirement b = Requirement.builder()
                .oneOf("os", "linux", "mac")
                .eq("interface", "REST")
                .atLeast("version", "2.3.0")
                .build();

        assertEquals("interface=REST;os=linux|mac;version in [2.3,*)", a.signature());
        assertEquals(a.signature(), b.signature());
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void conflictingClausesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Requirement.parse("interface=REST, interface=CLI"));
        assertThrows(IllegalArgumentException.class, () -> Requirement.parse("version>=3, version<2"));
        assertThrows(IllegalArgumentException.class, () -> Requirement.parse("interface REST"));
        assertThrows(IllegalArgumentException.class, () -> Requirement.parse("version>=abc"));
    }

    @Test
    void equivalentDuplicatesAreAccepted() {
        Requirement r = Requirement.parse("interface=REST, interface==REST");
        assertEquals("interface=REST", r.signature());
    }

    @Test
    void blankTextIsTheEmptyRequirement() {
        assertTrue(Requirement.parse("  ").isEmpty());
        assertSame(Requirement.none(), Requirement.parse(""));
    }

    @Test
    void matchRequiresEveryConstrainedAttribute() {
        Requirement wanted = Requirement.parse("interface=REST, version>=2.3");

        assertTrue(wanted.match(Requirement.parse("interface=REST, version=2.5")).matches());
        assertTrue(wanted.match(Requirement.parse("interface=REST|CLI, version>=2.0, os=linux")).matches());

        MatchReport tooOld = wanted.match(Requirement.parse("interface=REST, version=1.0"));
        assertFalse(tooOld.matches());
        assertEquals(List.of("version"), tooOld.unmetAttributes());

        MatchReport undeclared = wanted.match(Requirement.parse("interface=CLI"));
        assertEquals(List.of("interface", "version"), undeclared.unmetAttributes());
    }

    @Test
    void emptyRequirementMatchesAnything() {
        assertTrue(Requirement.none().match(Requirement.parse("interface=GUI")).matches());
        assertTrue(Requirement.none().match(Requirement.none()).matches());
    }

    @Test
    void andMergesAndIntersectsRanges() {
        Requirement merged = Requirement.parse("interface=REST, version>=2")
                .and(Requirement.parse("version<3, os=linux"));
        assertEquals("interface=REST;os=linux;version in [2,3)", merged.signature());
    }
}
