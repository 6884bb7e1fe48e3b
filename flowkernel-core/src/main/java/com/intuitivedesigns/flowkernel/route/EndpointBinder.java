/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.route;

import com.intuitivedesigns.flowkernel.compile.CompilationException;
import com.intuitivedesigns.flowkernel.compile.CompilationException.Kind;
import com.intuitivedesigns.flowkernel.compile.CompiledPipeline;
import com.intuitivedesigns.flowkernel.compile.PipelineCompiler;
import com.intuitivedesigns.flowkernel.model.DependencySpec;
import com.intuitivedesigns.flowkernel.model.EndpointSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compiles each endpoint's pipeline and registers one route per declared method.
 * Dependency pipelines are compiled once and shared by every endpoint that lists them.
 */
public final class EndpointBinder {

    private static final Logger log = LoggerFactory.getLogger(EndpointBinder.class);

    private final PipelineCompiler compiler;

    public EndpointBinder(PipelineCompiler compiler) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
    }

    public RouteTable bind(List<EndpointSpec> endpoints) {
        return bind(List.of(), endpoints);
    }

    public RouteTable bind(List<DependencySpec> dependencies, List<EndpointSpec> endpoints) {
        final Set<String> pipelineNames = new HashSet<>();
        final Map<String, CompiledPipeline> compiledDependencies = compileDependencies(dependencies, pipelineNames);
        final Map<RouteKey, RouteBinding> table = new LinkedHashMap<>();

        for (EndpointSpec endpoint : endpoints) {
            final String pipelineName = endpoint.pipeline().name();
            if (!pipelineNames.add(pipelineName)) {
                throw new CompilationException(Kind.DUPLICATE_PIPELINE,
                        "Pipeline name '" + pipelineName + "' is used by more than one endpoint or dependency");
            }

            // Check routes first so a clash is reported before any operator is built.
            for (String method : endpoint.methods()) {
                final RouteKey key = keyOf(endpoint, method);
                if (table.containsKey(key)) {
                    throw new CompilationException(Kind.DUPLICATE_ROUTE, "Route " + key + " is declared more than once");
                }
            }

            final List<CompiledPipeline> gates = new ArrayList<>(endpoint.depends().size());
            for (String name : endpoint.depends()) {
                final CompiledPipeline gate = compiledDependencies.get(name);
                if (gate == null) {
                    throw new CompilationException(Kind.UNKNOWN_DEPENDENCY,
                            "Endpoint '" + endpoint.exposedRoute() + "' depends on undeclared dependency '" + name + "'");
                }
                gates.add(gate);
            }

            final CompiledPipeline pipeline = compiler.compile(endpoint.pipeline());
            final RouteBinding binding = new RouteBinding(endpoint, gates, pipeline);
            for (String method : endpoint.methods()) {
                final RouteKey key = keyOf(endpoint, method);
                table.put(key, binding);
                log.info("Bound {} -> pipeline '{}'", key, pipelineName);
            }
        }

        return new RouteTable(table);
    }

    private Map<String, CompiledPipeline> compileDependencies(List<DependencySpec> dependencies, Set<String> pipelineNames) {
        final Map<String, CompiledPipeline> compiled = new LinkedHashMap<>();
        for (DependencySpec dependency : dependencies) {
            if (compiled.containsKey(dependency.name())) {
                throw new CompilationException(Kind.DUPLICATE_DEPENDENCY,
                        "Dependency '" + dependency.name() + "' is declared more than once");
            }
            final String pipelineName = dependency.pipeline().name();
            if (!pipelineNames.add(pipelineName)) {
                throw new CompilationException(Kind.DUPLICATE_PIPELINE,
                        "Pipeline name '" + pipelineName + "' is used by more than one dependency");
            }
            compiled.put(dependency.name(), compiler.compile(dependency.pipeline()));
            log.debug("Compiled dependency '{}' -> pipeline '{}'", dependency.name(), pipelineName);
        }
        return compiled;
    }

    static RouteKey keyOf(EndpointSpec endpoint, String method) {
        return new RouteKey(endpoint.version().major(), endpoint.version().minor(), endpoint.route(), method);
    }
}
