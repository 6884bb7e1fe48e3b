/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.metrics;

/**
 * Explicit opt-out: {@code metrics.provider: NOOP}.
 */
public final class NoopMetricsProvider implements MetricsProvider {

    @Override
    public String id() {
        return "NOOP";
    }

    @Override
    public MetricsRuntime create(MetricsSettings s) {
        // Only claim the runtime when NOOP was asked for, so other providers still get a chance.
        if (s == null || !matches(s.providerId)) {
            return null;
        }
        return MetricsRuntime.noop();
    }
}
