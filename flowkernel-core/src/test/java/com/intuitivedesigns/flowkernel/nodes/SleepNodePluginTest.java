/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.nodes;

import com.intuitivedesigns.flowkernel.config.NodeConfig;
import com.intuitivedesigns.flowkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.flowkernel.spi.NodeOperator;
import com.intuitivedesigns.flowkernel.spi.NodeResult;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SleepNodePluginTest {

    private final SleepNodePlugin plugin = new SleepNodePlugin();

    @Test
    void testSleepsAndPassesInputsThrough() throws Exception {
        NodeOperator op = plugin.create(NodeConfig.of(Map.of("ms", 30)), MetricsRuntime.noop());
        Map<String, Object> data = new HashMap<>(Map.of("k", "v"));

        long start = System.nanoTime();
        NodeResult r = op.apply(data, new HashMap<>());
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(elapsedMs >= 25, "slept " + elapsedMs + "ms");
        assertSame(data, r.data());
    }

    @Test
    void testMsIsRequiredAndNonNegative() {
        assertThrows(IllegalArgumentException.class, () -> plugin.create(NodeConfig.empty(), MetricsRuntime.noop()));
        assertThrows(IllegalArgumentException.class,
                () -> plugin.create(NodeConfig.of(Map.of("ms", -1)), MetricsRuntime.noop()));
        assertThrows(IllegalArgumentException.class,
                () -> plugin.create(NodeConfig.of(Map.of("ms", "soon")), MetricsRuntime.noop()));
    }

    @Test
    void testInterruptPropagates() throws Exception {
        NodeOperator op = plugin.create(NodeConfig.of(Map.of("ms", 5_000)), MetricsRuntime.noop());

        Thread.currentThread().interrupt();
        try {
            assertThrows(InterruptedException.class, () -> op.apply(new HashMap<>(), new HashMap<>()));
        } finally {
            Thread.interrupted();
        }
    }
}
