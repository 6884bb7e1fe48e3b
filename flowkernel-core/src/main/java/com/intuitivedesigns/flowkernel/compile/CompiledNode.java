/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.compile;

import com.intuitivedesigns.flowkernel.spi.NodeOperator;

import java.util.Objects;
import java.util.Set;

/**
 * One node of a compiled pipeline with its operator already bound.
 *
 * @param predecessors names of the nodes with an edge into this one
 */
public record CompiledNode(String name, String type, String version, NodeOperator operator, Set<String> predecessors) {

    public CompiledNode {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(operator, "operator");
        predecessors = Set.copyOf(predecessors);
    }

    public String typeLabel() {
        return type + "@" + version;
    }
}
