/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.nodes;

import com.intuitivedesigns.flowkernel.spi.NodeExtension;
import com.intuitivedesigns.flowkernel.spi.NodeTypeRegistrar;

/**
 * Node types available without listing any extension. Registered directly, not through ServiceLoader.
 */
public final class BuiltinNodeExtension implements NodeExtension {

    public static final String ID = "BUILTIN";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public void register(NodeTypeRegistrar registrar) {
        registrar.register(new TransformerNodePlugin());
        registrar.register(new SleepNodePlugin());
        registrar.register(new PassthroughNodePlugin());
    }
}
