package com.questrail.flightdeck.constraint;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConstraintAlgebraTest {

    private static Constraint.Range range(String lower, boolean li, String upper, boolean ui) {
        return new Constraint.Range("version",
                lower == null ? null : Version.parse(lower), li,
                upper == null ? null : Version.parse(upper), ui);
    }

    @Test
    void equalityAdmitsVersionEquivalentValues() {
        Constraint eq = new Constraint.Equals("version", "2.3");
        assertTrue(eq.admits("2.3.0"));
        assertFalse(eq.admits("2.4"));

        Constraint iface = new Constraint.Equals("interface", "REST");
        assertTrue(iface.admits("REST"));
        assertFalse(iface.admits("rest"));
        assertFalse(iface.admits(null));
    }

    @Test
    void rangeBoundsHonourInclusivity() {
        Constraint.Range r = range("2.0", true, "3.0", false);
        assertTrue(r.admits("2.0"));
        assertTrue(r.admits("2.9.9"));
        assertFalse(r.admits("3.0"));
        assertFalse(r.admits("1.9"));
        assertFalse(r.admits("not-a-version"));
    }

    @Test
    void operatorsBuildTheExpectedVariants() {
        assertInstanceOf(Constraint.Equals.class, Constraint.of("a", Operator.EQ, "x"));
        assertInstanceOf(Constraint.Excludes.class, Constraint.of("a", Operator.NE, "x"));
        assertEquals(" in [2.3,*)", Constraint.of("v", Operator.GE, "2.3").canonicalPredicate());
        assertEquals(" in (2.3,*)", Constraint.of("v", Operator.GT, "2.3").canonicalPredicate());
        assertEquals(" in (*,2.3)", Constraint.of("v", Operator.LT, "2.3").canonicalPredicate());
        assertEquals(" in (*,2.3]", Constraint.of("v", Operator.LE, "2.3").canonicalPredicate());
    }

    @Test
    void emptyRangesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> range("3.0", true, "2.0", true));
        assertThrows(IllegalArgumentException.class, () -> range("2.0", false, "2.0", true));
        assertThrows(IllegalArgumentException.class, () -> range(null, false, null, false));
        assertTrue(range("2.0", true, "2.0", true).isPoint());
    }

    @Test
    void subsetRelations() {
        Constraint.Range wide = range("2.0", true, null, false);
        Constraint.Range narrow = range("2.3", true, "3.0", false);
        assertTrue(ConstraintAlgebra.isSubsetOf(narrow, wide));
        assertFalse(ConstraintAlgebra.isSubsetOf(wide, narrow));

        Constraint point = new Constraint.Equals("version", "2.5");
        assertTrue(ConstraintAlgebra.isSubsetOf(point, narrow));

        Constraint rest = new Constraint.Equals("interface", "REST");
        Constraint restOrCli = new Constraint.OneOf("interface", Set.of("REST", "CLI"));
        assertTrue(ConstraintAlgebra.isSubsetOf(rest, restOrCli));
        assertFalse(ConstraintAlgebra.isSubsetOf(restOrCli, rest));

        Constraint notGui = new Constraint.Excludes("interface", Set.of("GUI"));
        Constraint notGuiOrCli = new Constraint.Excludes("interface", Set.of("GUI", "CLI"));
        assertTrue(ConstraintAlgebra.isSubsetOf(notGuiOrCli, notGui));
        assertFalse(ConstraintAlgebra.isSubsetOf(notGui, notGuiOrCli));
        assertTrue(ConstraintAlgebra.isSubsetOf(rest, notGui));
        assertFalse(ConstraintAlgebra.isSubsetOf(notGui, restOrCli));
    }

    @Test
    void intersectionOfRanges() {
        assertTrue(ConstraintAlgebra.intersects(range("2.3", true, null, false), range("2.0", true, "3.0", false)));
        assertFalse(ConstraintAlgebra.intersects(range("2.3", true, null, false), range(null, false, "2.3", false)));
        assertTrue(ConstraintAlgebra.intersects(range("2.3", true, null, false), range(null, false, "2.3", true)));
    }

    @Test
    void intersectionAcrossVariants() {
        Constraint atLeast23 = range("2.3", true, null, false);
        assertFalse(ConstraintAlgebra.intersects(atLeast23, new Constraint.Equals("version", "1.0")));
        assertTrue(ConstraintAlgebra.intersects(atLeast23, new Constraint.OneOf("version", Set.of("1.0", "2.4"))));
        assertTrue(ConstraintAlgebra.intersects(new Constraint.Excludes("os", Set.of("win")),
                new Constraint.Excludes("os", Set.of("mac"))));
        assertFalse(ConstraintAlgebra.intersects(new Constraint.Excludes("os", Set.of("win")),
                new Constraint.Equals("os", "win")));
    }

    @Test
    void rangeIntersectionTakesTheTighterBounds() {
        Constraint.Range r = ConstraintAlgebra.intersectRanges(
                range("2.0", true, null, false), range("2.3", false, "3.0", true));
        assertEquals(" in (2.3,3]", r.canonicalPredicate());
        assertThrows(IllegalArgumentException.class, () -> ConstraintAlgebra.intersectRanges(
                range("3.0", true, null, false), range(null, false, "2.0", true)));
    }
}
