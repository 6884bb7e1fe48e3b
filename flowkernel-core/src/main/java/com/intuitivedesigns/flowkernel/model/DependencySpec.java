/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.model;

import java.util.Objects;

/**
 * A named pipeline that endpoints list under {@code depends}. It runs against the same request
 * data before the endpoint's own pipeline; only its success matters, its output is discarded.
 */
public record DependencySpec(String name, PipelineDef pipeline) {

    public DependencySpec {
        name = Objects.requireNonNull(name, "name").trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Dependency name must not be empty");
        }
        Objects.requireNonNull(pipeline, "pipeline");
    }
}
