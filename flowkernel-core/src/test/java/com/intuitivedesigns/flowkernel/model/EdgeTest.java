/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EdgeTest {

    @Test
    void testSingleEdge() {
        assertEquals(List.of(new Edge("I", "O")), Edge.parse("I -> O"));
        assertEquals(List.of(new Edge("I", "O")), Edge.parse("I->O"));
    }

    @Test
    void testChainExpandsToConsecutivePairs() {
        assertEquals(
                List.of(new Edge("I", "A0"), new Edge("A0", "A1"), new Edge("A1", "O")),
                Edge.parse("I -> A0 -> A1 -> O"));
    }

    @Test
    void testRejectsMalformedLines() {
        assertThrows(IllegalArgumentException.class, () -> Edge.parse("I O"));
        assertThrows(IllegalArgumentException.class, () -> Edge.parse("I -> "));
        assertThrows(IllegalArgumentException.class, () -> Edge.parse(null));
    }
}
