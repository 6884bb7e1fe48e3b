/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.model;

import java.util.List;
import java.util.Objects;

/**
 * Declared pipeline: nodes in declaration order plus the edges between them.
 * Structural validation (names, edges, cycles) belongs to the compiler.
 */
public record PipelineDef(String name, List<NodeDef> nodes, List<Edge> edges) {

    public PipelineDef {
        Objects.requireNonNull(name, "name");
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }
}
