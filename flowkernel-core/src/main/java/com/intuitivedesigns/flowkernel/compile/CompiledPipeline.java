/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.compile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Validated, topologically ordered and fully bound pipeline. Immutable and shared by all requests.
 */
public final class CompiledPipeline {

    private final String name;
    private final List<CompiledNode> nodes;

    CompiledPipeline(String name, List<CompiledNode> nodes) {
        this.name = Objects.requireNonNull(name, "name");
        this.nodes = List.copyOf(nodes);
    }

    public String name() {
        return name;
    }

    /** Nodes in execution order. */
    public List<CompiledNode> nodes() {
        return nodes;
    }

    public List<String> order() {
        final List<String> names = new ArrayList<>(nodes.size());
        for (CompiledNode n : nodes) names.add(n.name());
        return names;
    }

    public int size() {
        return nodes.size();
    }

    @Override
    public String toString() {
        return "CompiledPipeline{" + name + " " + order() + "}";
    }
}
