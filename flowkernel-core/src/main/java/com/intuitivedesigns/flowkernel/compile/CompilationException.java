/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.compile;

import java.util.Objects;

/**
 * Startup failure while building the registry, compiling a pipeline or binding endpoints.
 */
public class CompilationException extends RuntimeException {

    public enum Kind {
        DUPLICATE_NODE_TYPE,
        UNKNOWN_NODE_TYPE,
        INVALID_NODE_CONFIG,
        DUPLICATE_NODE_NAME,
        DANGLING_EDGE,
        CYCLIC_PIPELINE,
        EMPTY_PIPELINE,
        DUPLICATE_ROUTE,
        DUPLICATE_PIPELINE,
        DUPLICATE_DEPENDENCY,
        UNKNOWN_DEPENDENCY
    }

    private final Kind kind;

    public CompilationException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public CompilationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public String toString() {
        return "CompilationException[" + kind + "]: " + getMessage();
    }
}
