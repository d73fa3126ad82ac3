package com.questrail.flightdeck.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NodeIdTest {

    @Test
    void childPathsAreSlashJoined() {
        NodeId step = NodeId.root("nightly").child("login").child("happy").child("submit");

        assertEquals("nightly/login/happy/submit", step.toString());
        assertEquals(4, step.depth());
        assertEquals("submit", step.leaf());
        assertEquals(1, NodeId.root("nightly").depth());
    }

    @Test
    void blankPathIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new NodeId(" "));
    }
}
