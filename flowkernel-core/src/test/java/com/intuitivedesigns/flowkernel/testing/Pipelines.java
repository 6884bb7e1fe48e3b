/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.testing;

import com.intuitivedesigns.flowkernel.config.NodeConfig;
import com.intuitivedesigns.flowkernel.model.ApiVersion;
import com.intuitivedesigns.flowkernel.model.ConcurrencyLimit;
import com.intuitivedesigns.flowkernel.model.DependencySpec;
import com.intuitivedesigns.flowkernel.model.Edge;
import com.intuitivedesigns.flowkernel.model.EndpointSpec;
import com.intuitivedesigns.flowkernel.model.NodeDef;
import com.intuitivedesigns.flowkernel.model.PipelineDef;
import com.intuitivedesigns.flowkernel.nodes.BuiltinNodeExtension;
import com.intuitivedesigns.flowkernel.registry.NodeTypeRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Builders for test pipelines and endpoints. */
public final class Pipelines {

    private Pipelines() {}

    public static NodeDef node(String name, String type) {
        return new NodeDef(name, type, "1.0", NodeConfig.empty());
    }

    public static NodeDef node(String name, String type, Map<String, ?> config) {
        return new NodeDef(name, type, "1.0", NodeConfig.of(config));
    }

    /** Edges as digraph lines, e.g. {@code "A -> B -> C"}. */
    public static PipelineDef pipeline(String name, List<NodeDef> nodes, String... digraph) {
        final List<Edge> edges = new ArrayList<>();
        for (String line : digraph) {
            edges.addAll(Edge.parse(line));
        }
        return new PipelineDef(name, nodes, edges);
    }

    public static EndpointSpec endpoint(String route, String version, PipelineDef pipeline, String... methods) {
        return new EndpointSpec(route, Set.of(methods), 0, 1_048_576, ApiVersion.parse(version), pipeline, null);
    }

    public static EndpointSpec endpoint(String route, long minSize, long maxSize, ConcurrencyLimit limit,
                                        PipelineDef pipeline, String... methods) {
        return new EndpointSpec(route, Set.of(methods), minSize, maxSize, ApiVersion.parse("1.0"), pipeline, limit);
    }

    /** A {@code 1.0} endpoint on GET and POST that runs the named dependencies first. */
    public static EndpointSpec dependent(String route, PipelineDef pipeline, String... depends) {
        return new EndpointSpec(route, Set.of("GET", "POST"), 0, 1_048_576, ApiVersion.parse("1.0"), pipeline, null,
                List.of(depends));
    }

    public static DependencySpec dependency(String name, NodeDef... nodes) {
        return new DependencySpec(name, pipeline(name, List.of(nodes)));
    }

    /** Built-ins plus the counting extension, frozen. */
    public static NodeTypeRegistry registry() {
        final NodeTypeRegistry registry = new NodeTypeRegistry();
        new BuiltinNodeExtension().register(registry);
        new CountingNodeExtension().register(registry);
        registry.freeze();
        return registry;
    }
}
