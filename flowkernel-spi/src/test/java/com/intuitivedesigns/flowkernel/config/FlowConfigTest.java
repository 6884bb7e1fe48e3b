/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.config;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FlowConfigTest {

    private static FlowConfig sample() {
        Map<String, Object> server = new HashMap<>();
        server.put("workers", "16");
        server.put("request-timeout-ms", 2500);
        return FlowConfig.of(Map.of(
                "port", 8080,
                "server", server,
                "ssl", Map.of("enabled", "TRUE"),
                "extensions", List.of("a", "b"),
                "metrics", Map.of("tag", Map.of("app", "flowapi", "env", "dev"))));
    }

    @Test
    void testDottedPathLookup() {
        FlowConfig cfg = sample();

        assertEquals(8080, cfg.getInt("port", 1979));
        assertEquals(16, cfg.getInt("server.workers", 64));
        assertEquals(2500L, cfg.getLong("server.request-timeout-ms", 30_000L));
        assertTrue(cfg.getBoolean("ssl.enabled", false));
        assertEquals("fallback", cfg.getString("server.missing", "fallback"));
        assertNull(cfg.get("port.nested"));
        assertTrue(cfg.hasPath("metrics.tag.app"));
        assertFalse(cfg.hasPath("metrics.tag.team"));
    }

    @Test
    void testListsAndSections() {
        FlowConfig cfg = sample();

        assertEquals(List.of("a", "b"), cfg.getList("extensions"));
        assertTrue(cfg.getList("absent").isEmpty());
        assertEquals(16, cfg.section("server").getInt("workers", 0));
        assertTrue(cfg.section("absent").keys().isEmpty());
    }

    @Test
    void testFlatMapExposesLeaves() {
        Map<String, Object> flat = sample().asFlatMap();

        assertEquals("flowapi", flat.get("metrics.tag.app"));
        assertEquals("dev", flat.get("metrics.tag.env"));
        assertEquals(List.of("a", "b"), flat.get("extensions"));
    }

    @Test
    void testBadScalarsAreRejected() {
        FlowConfig cfg = FlowConfig.of(Map.of("port", "eighty", "flag", "maybe", "list", "x"));

        assertThrows(IllegalArgumentException.class, () -> cfg.getInt("port", 0));
        assertThrows(IllegalArgumentException.class, () -> cfg.getBoolean("flag", false));
        assertThrows(IllegalArgumentException.class, () -> cfg.getList("list"));
        assertThrows(IllegalArgumentException.class, () -> cfg.section("port"));
    }

    @Test
    void testDocumentIsCopiedAndImmutable() {
        Map<String, Object> source = new HashMap<>();
        source.put("port", 1);
        FlowConfig cfg = FlowConfig.of(source);
        source.put("port", 2);

        assertEquals(1, cfg.getInt("port", 0));
        assertThrows(UnsupportedOperationException.class, () -> cfg.getList("x").add("y"));
    }
}
