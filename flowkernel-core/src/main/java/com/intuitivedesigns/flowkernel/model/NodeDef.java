/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.model;

import com.intuitivedesigns.flowkernel.config.NodeConfig;

import java.util.Objects;

/**
 * One declared node of a pipeline.
 */
public record NodeDef(String name, String type, String version, NodeConfig config) {

    public NodeDef {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(version, "version");
        config = (config == null) ? NodeConfig.empty() : config;
    }

    public String typeLabel() {
        return type + "@" + version;
    }
}
