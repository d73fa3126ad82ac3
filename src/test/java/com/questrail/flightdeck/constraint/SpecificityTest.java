package com.questrail.flightdeck.constraint;

import org.junit.jupiter.api.Test;

import static com.questrail.flightdeck.constraint.Specificity.Comparison.*;
import static org.junit.jupiter.api.Assertions.*;

class SpecificityTest {

    private static Specificity.Comparison compare(String a, String b) {
        return Specificity.compare(Requirement.parse(a), Requirement.parse(b));
    }

    @Test
    void identicalDeclarationsAreEqual() {
        assertEquals(EQUAL, compare("interface=REST", "interface=REST"));
        assertEquals(EQUAL, compare("version>=2.3", "version>=2.3.0"));
    }

    @Test
    void extraConstrainedAttributeIsMoreSpecific() {
        assertEquals(MORE_SPECIFIC, compare("interface=REST, version=2.5", "interface=REST"));
        assertEquals(LESS_SPECIFIC, compare("interface=REST", "interface=REST, version=2.5"));
    }

    @Test
    void narrowerPredicateIsMoreSpecific() {
        assertEquals(MORE_SPECIFIC, compare("version>=2.3, version<3", "version>=2"));
        assertEquals(MORE_SPECIFIC, compare("interface=REST", "interface=REST|CLI"));
        assertEquals(MORE_SPECIFIC, compare("version=2.5", "version>=2"));
    }

    @Test
    void crossingDeclarationsAreIncomparable() {
        assertEquals(INCOMPARABLE, compare("interface=REST, os=linux", "interface=REST, version=2"));
        assertEquals(INCOMPARABLE, compare("version>=2", "version<3"));
        assertEquals(INCOMPARABLE, compare("interface=REST", "interface=CLI"));
    }

    @Test
    void isMoreSpecificIsStrict() {
        Requirement r = Requirement.parse("interface=REST");
        assertFalse(Specificity.isMoreSpecific(r, r));
        assertTrue(Specificity.isMoreSpecific(Requirement.parse("interface=REST, os=linux"), r));
    }
}
