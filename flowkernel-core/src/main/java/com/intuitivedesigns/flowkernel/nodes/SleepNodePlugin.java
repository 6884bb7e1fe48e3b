/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.nodes;

import com.intuitivedesigns.flowkernel.config.NodeConfig;
import com.intuitivedesigns.flowkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.flowkernel.spi.NodeOperator;
import com.intuitivedesigns.flowkernel.spi.NodePlugin;
import com.intuitivedesigns.flowkernel.spi.NodeResult;

/**
 * {@code sleep 1.0}: blocks the worker for {@code ms} milliseconds, then passes inputs on.
 * Interruption propagates as {@link InterruptedException}.
 */
public final class SleepNodePlugin implements NodePlugin {

    public static final String TYPE = "sleep";
    public static final String VERSION = "1.0";

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public String version() {
        return VERSION;
    }

    @Override
    public NodeOperator create(NodeConfig config, MetricsRuntime metrics) {
        if (!config.has("ms")) {
            throw new IllegalArgumentException("sleep requires 'ms'");
        }
        final long ms = config.getLong("ms", 0L);
        if (ms < 0) {
            throw new IllegalArgumentException("sleep 'ms' must be >= 0, got " + ms);
        }
        return (data, state) -> {
            if (ms > 0) {
                Thread.sleep(ms);
            }
            return NodeResult.of(data, state);
        };
    }
}
