/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.ServiceLoader;

public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    private MetricsFactory() {}

    public static MetricsRuntime init(MetricsSettings settings) {
        return init(settings, resolveClassLoader());
    }

    public static MetricsRuntime init(MetricsSettings settings, ClassLoader cl) {
        Objects.requireNonNull(settings, "settings");

        if (MetricsSettings.PROVIDER_NONE.equals(settings.providerId)) {
            log.info("Metrics disabled (metrics.provider={})", settings.providerId);
            return MetricsRuntime.noop();
        }

        final ServiceLoader<MetricsProvider> loader = ServiceLoader.load(MetricsProvider.class, cl);
        for (MetricsProvider p : loader) {
            try {
                final MetricsRuntime rt = p.create(settings);
                if (rt != null) {
                    log.info("Metrics runtime initialized: {} ({})", p.id(), p.getClass().getName());
                    return rt;
                }
            } catch (LinkageError e) {
                // A provider jar without its backend on the classpath must not take the server down.
                log.warn("Metrics provider [{}] is missing dependencies: {}", p.getClass().getName(), e.getMessage());
            }
        }

        log.warn("No metrics provider matched '{}'; metrics disabled.", settings.providerId);
        return MetricsRuntime.noop();
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader threadCl = Thread.currentThread().getContextClassLoader();
        return (threadCl != null) ? threadCl : MetricsFactory.class.getClassLoader();
    }
}
