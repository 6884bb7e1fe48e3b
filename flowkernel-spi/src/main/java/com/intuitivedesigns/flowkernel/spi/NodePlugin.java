/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.spi;

import com.intuitivedesigns.flowkernel.config.NodeConfig;
import com.intuitivedesigns.flowkernel.metrics.MetricsRuntime;

/**
 * SPI Definition for pipeline node types.
 *
 * <p>A node type is identified by {@code (type, version)}. The pipeline compiler resolves
 * every declared node against the registry and calls {@link #create} once per node, so
 * configuration errors surface at startup instead of on the first request.</p>
 */
public interface NodePlugin {

    String type(); // e.g. "transformer", "sleep"

    String version(); // e.g. "1.0"

    /**
     * Binds this node type to one node's configuration.
     *
     * @throws Exception if the configuration is invalid for this type
     */
    NodeOperator create(NodeConfig config, MetricsRuntime metrics) throws Exception;
}
