/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.metrics;

/**
 * Service Provider Interface (SPI) for metrics backends.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and registered in
 * {@code META-INF/services/com.intuitivedesigns.flowkernel.metrics.MetricsProvider}.
 */
public interface MetricsProvider {

    /**
     * The identifier matched against {@code metrics.provider} (e.g., "PROMETHEUS").
     */
    String id();

    /**
     * @return a runtime if this provider is the one selected by the settings, otherwise {@code null}
     */
    MetricsRuntime create(MetricsSettings settings);

    default boolean matches(String configuredId) {
        return configuredId != null && id().equalsIgnoreCase(configuredId.trim());
    }
}
