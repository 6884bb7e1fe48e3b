/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A declared endpoint. Size bounds apply to the raw request body in bytes.
 *
 * @param route       route below the version prefix, without leading or trailing slashes
 * @param methods     upper-case HTTP verbs, never empty
 * @param concurrency optional in-flight bound, {@code null} when unbounded
 * @param depends     names of {@link DependencySpec}s to run first, in order
 */
public record EndpointSpec(String route,
                           Set<String> methods,
                           long minSize,
                           long maxSize,
                           ApiVersion version,
                           PipelineDef pipeline,
                           ConcurrencyLimit concurrency,
                           List<String> depends) {

    public EndpointSpec {
        route = Objects.requireNonNull(route, "route").replaceAll("^/+|/+$", "");
        if (route.isEmpty()) {
            throw new IllegalArgumentException("Endpoint route must not be empty");
        }
        Objects.requireNonNull(pipeline, "pipeline");
        methods = Set.copyOf(methods);
        depends = (depends == null) ? List.of() : List.copyOf(depends);
        version = (version == null) ? ApiVersion.DEFAULT : version;
        if (methods.isEmpty()) {
            throw new IllegalArgumentException("Endpoint '" + route + "' declares no methods");
        }
        if (minSize < 0 || maxSize < 0) {
            throw new IllegalArgumentException("Endpoint '" + route + "' size bounds must be non-negative");
        }
        if (minSize > maxSize) {
            throw new IllegalArgumentException("Endpoint '" + route + "' has min_size > max_size (" + minSize + " > " + maxSize + ")");
        }
    }

    public EndpointSpec(String route, Set<String> methods, long minSize, long maxSize, ApiVersion version,
                        PipelineDef pipeline, ConcurrencyLimit concurrency) {
        this(route, methods, minSize, maxSize, version, pipeline, concurrency, List.of());
    }

    /** {@code v<major>/<minor>/<route>} */
    public String exposedRoute() {
        return version.pathPrefix() + "/" + route;
    }

    public Optional<ConcurrencyLimit> concurrencyLimit() {
        return Optional.ofNullable(concurrency);
    }
}
