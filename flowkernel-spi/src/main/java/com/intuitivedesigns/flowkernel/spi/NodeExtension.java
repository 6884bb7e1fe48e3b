/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.spi;

/**
 * SPI Definition for extensions contributing additional node types.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and registered in
 * {@code META-INF/services/com.intuitivedesigns.flowkernel.spi.NodeExtension}. Only the
 * extensions listed under {@code extensions} in the configuration are activated.</p>
 */
public interface NodeExtension extends ServicePlugin {

    String id(); // e.g. "EXAMPLE"

    void register(NodeTypeRegistrar registrar);
}
