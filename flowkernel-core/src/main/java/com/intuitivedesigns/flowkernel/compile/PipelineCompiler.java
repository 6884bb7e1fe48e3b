/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.compile;

import com.intuitivedesigns.flowkernel.compile.CompilationException.Kind;
import com.intuitivedesigns.flowkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.flowkernel.model.Edge;
import com.intuitivedesigns.flowkernel.model.NodeDef;
import com.intuitivedesigns.flowkernel.model.PipelineDef;
import com.intuitivedesigns.flowkernel.registry.NodeTypeRegistry;
import com.intuitivedesigns.flowkernel.spi.NodeOperator;
import com.intuitivedesigns.flowkernel.spi.NodePlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Turns a {@link PipelineDef} into a {@link CompiledPipeline}.
 *
 * <p>Checks run in a fixed order so the first reported error is predictable:
 * duplicate names, dangling edges, cycles, unknown node types, then operator creation.
 * Topological order uses Kahn's algorithm; among ready nodes the one declared first wins,
 * so the same definition always compiles to the same order.</p>
 */
public final class PipelineCompiler {

    private static final Logger log = LoggerFactory.getLogger(PipelineCompiler.class);

    private final NodeTypeRegistry registry;
    private final MetricsRuntime metrics;

    public PipelineCompiler(NodeTypeRegistry registry, MetricsRuntime metrics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.noop();
        if (!registry.isFrozen()) {
            throw new IllegalStateException("Node type registry must be frozen before compiling pipelines");
        }
    }

    public CompiledPipeline compile(PipelineDef def) {
        Objects.requireNonNull(def, "def");
        final String pipeline = def.name();

        if (def.nodes().isEmpty()) {
            throw new CompilationException(Kind.EMPTY_PIPELINE, "Pipeline '" + pipeline + "' declares no nodes");
        }

        // 1. names
        final Map<String, Integer> index = new LinkedHashMap<>();
        for (NodeDef n : def.nodes()) {
            if (index.putIfAbsent(n.name(), index.size()) != null) {
                throw new CompilationException(Kind.DUPLICATE_NODE_NAME,
                        "Pipeline '" + pipeline + "' declares node '" + n.name() + "' more than once");
            }
        }

        // 2. edges; repeated edges collapse into one
        final Map<String, Set<String>> successors = new HashMap<>();
        final Map<String, Set<String>> predecessors = new HashMap<>();
        for (String name : index.keySet()) {
            successors.put(name, new LinkedHashSet<>());
            predecessors.put(name, new LinkedHashSet<>());
        }
        for (Edge e : def.edges()) {
            if (!index.containsKey(e.source()) || !index.containsKey(e.target())) {
                final String missing = index.containsKey(e.source()) ? e.target() : e.source();
                throw new CompilationException(Kind.DANGLING_EDGE,
                        "Pipeline '" + pipeline + "' edge " + e + " references undeclared node '" + missing + "'");
            }
            if (successors.get(e.source()).add(e.target())) {
                predecessors.get(e.target()).add(e.source());
            }
        }

        // 3. order
        final List<NodeDef> ordered = topologicalOrder(def, index, successors, predecessors);

        // 4 + 5. resolve and bind
        final List<CompiledNode> compiled = new ArrayList<>(ordered.size());
        for (NodeDef n : ordered) {
            final NodePlugin plugin = registry.resolve(n.type(), n.version());
            compiled.add(new CompiledNode(n.name(), n.type(), n.version(),
                    bind(pipeline, n, plugin), predecessors.get(n.name())));
        }

        final CompiledPipeline result = new CompiledPipeline(pipeline, compiled);
        log.info("Compiled pipeline '{}' order={}", pipeline, result.order());
        return result;
    }

    private static List<NodeDef> topologicalOrder(PipelineDef def,
                                                  Map<String, Integer> index,
                                                  Map<String, Set<String>> successors,
                                                  Map<String, Set<String>> predecessors) {
        final Map<String, Integer> inDegree = new HashMap<>();
        final PriorityQueue<String> ready = new PriorityQueue<>((a, b) -> Integer.compare(index.get(a), index.get(b)));
        for (String name : index.keySet()) {
            final int d = predecessors.get(name).size();
            inDegree.put(name, d);
            if (d == 0) ready.add(name);
        }

        final List<NodeDef> out = new ArrayList<>(index.size());
        while (!ready.isEmpty()) {
            final String name = ready.poll();
            out.add(def.nodes().get(index.get(name)));
            for (String next : successors.get(name)) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }

        if (out.size() != index.size()) {
            final List<String> stuck = new ArrayList<>();
            for (String name : index.keySet()) {
                if (inDegree.get(name) > 0) stuck.add(name);
            }
            throw new CompilationException(Kind.CYCLIC_PIPELINE,
                    "Pipeline '" + def.name() + "' contains a cycle through " + stuck);
        }
        return out;
    }

    private NodeOperator bind(String pipeline, NodeDef n, NodePlugin plugin) {
        final NodeOperator op;
        try {
            op = plugin.create(n.config(), metrics);
        } catch (CompilationException e) {
            throw e;
        } catch (Exception e) {
            throw new CompilationException(Kind.INVALID_NODE_CONFIG,
                    "Pipeline '" + pipeline + "' node '" + n.name() + "' (" + n.typeLabel() + "): " + e.getMessage(), e);
        }
        if (op == null) {
            throw new CompilationException(Kind.INVALID_NODE_CONFIG,
                    "Node type " + n.typeLabel() + " returned no operator for node '" + n.name() + "'");
        }
        return op;
    }
}
