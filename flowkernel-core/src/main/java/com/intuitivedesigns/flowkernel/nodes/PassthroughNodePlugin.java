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

/** {@code passthrough 1.0}: returns its inputs unchanged. Useful as an explicit entry or exit node. */
public final class PassthroughNodePlugin implements NodePlugin {

    private static final NodeOperator IDENTITY = NodeResult::of;

    @Override
    public String type() {
        return "passthrough";
    }

    @Override
    public String version() {
        return "1.0";
    }

    @Override
    public NodeOperator create(NodeConfig config, MetricsRuntime metrics) {
        return IDENTITY;
    }
}
