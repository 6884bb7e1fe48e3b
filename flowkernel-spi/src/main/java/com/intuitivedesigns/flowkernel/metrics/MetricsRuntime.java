/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.metrics;

/**
 * Vendor-agnostic metrics contract used by the dispatcher and by node operators.
 *
 * <p>Every recording method has a NOOP default so a runtime without a backend costs nothing.</p>
 */
public interface MetricsRuntime extends AutoCloseable {

    /**
     * Returns the underlying registry (e.g., MeterRegistry) for advanced usage.
     * Typed as Object so callers do not need Micrometer on their compile path.
     */
    Object registry();

    default boolean enabled() { return false; }

    /**
     * @return identifier of the implementation (e.g., "PROMETHEUS", "NOOP").
     */
    default String type() { return "NOOP"; }

    default void counter(String name) {}

    /**
     * Increments a counter carrying tags given as alternating key/value strings.
     */
    default void taggedCounter(String name, String... tagKeyValues) {}

    default void timer(String name, long durationMillis) {}

    default void gauge(String name, double value) {}

    @Override
    default void close() {
        // no-op by default
    }

    static MetricsRuntime noop() {
        return NoopHolder.INSTANCE;
    }

    final class NoopHolder {
        private static final MetricsRuntime INSTANCE = () -> NoopHolder.class;

        private NoopHolder() {}
    }
}
