/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.route;

import com.intuitivedesigns.flowkernel.compile.CompiledPipeline;
import com.intuitivedesigns.flowkernel.model.EndpointSpec;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;

/**
 * What a route resolves to. Every method of one endpoint shares the same binding,
 * so the concurrency permits are counted per endpoint.
 */
public final class RouteBinding {

    private final EndpointSpec endpoint;
    private final CompiledPipeline pipeline;
    private final List<CompiledPipeline> dependencies;
    private final Semaphore permits; // nullable

    RouteBinding(EndpointSpec endpoint, List<CompiledPipeline> dependencies, CompiledPipeline pipeline) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.dependencies = List.copyOf(dependencies);
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.permits = endpoint.concurrencyLimit()
                .map(c -> new Semaphore(c.limit(), true))
                .orElse(null);
    }

    public EndpointSpec endpoint() {
        return endpoint;
    }

    public CompiledPipeline pipeline() {
        return pipeline;
    }

    /** Pipelines that must succeed before {@link #pipeline()} runs, in {@code depends} order. */
    public List<CompiledPipeline> dependencies() {
        return dependencies;
    }

    public Optional<Semaphore> permits() {
        return Optional.ofNullable(permits);
    }
}
