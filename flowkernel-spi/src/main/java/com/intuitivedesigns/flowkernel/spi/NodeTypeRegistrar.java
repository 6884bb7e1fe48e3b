/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.spi;

/**
 * Write side of the node type registry, handed to extensions during startup.
 */
public interface NodeTypeRegistrar {

    /**
     * @throws IllegalStateException once the registry has been frozen
     */
    void register(NodePlugin plugin);
}
