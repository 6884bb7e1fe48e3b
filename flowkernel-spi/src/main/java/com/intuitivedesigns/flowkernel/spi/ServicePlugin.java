/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.flowkernel.spi;

/**
 * Anything discovered through {@link java.util.ServiceLoader} and addressed by id.
 */
public interface ServicePlugin {
    /**
     * @return The unique ID of this implementation (e.g., 'EXAMPLE'). Compared after {@link PluginIds#normalize}.
     */
    String id();
}
