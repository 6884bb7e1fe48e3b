/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.metrics;

import com.intuitivedesigns.flowkernel.config.FlowConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable metrics settings read from the {@code metrics} section of the server configuration.
 */
public final class MetricsSettings {

    public static final String PROVIDER_NONE = "NONE";

    private static final String KEY_PROVIDER = "metrics.provider";
    private static final String KEY_TAG_PREFIX = "metrics.tag.";
    private static final String KEY_PROM_PORT = "metrics.prometheus.port";
    private static final String KEY_PROM_PATH = "metrics.prometheus.path";

    private static final int DEFAULT_PROM_PORT = 9090;
    private static final String DEFAULT_PROM_PATH = "/metrics";

    public final String providerId;
    public final Map<String, String> commonTags;
    public final int prometheusPort;
    public final String prometheusPath;

    private MetricsSettings(String providerId, Map<String, String> commonTags, int prometheusPort, String prometheusPath) {
        this.providerId = providerId;
        this.commonTags = commonTags;
        this.prometheusPort = prometheusPort;
        this.prometheusPath = prometheusPath;
    }

    public static MetricsSettings from(FlowConfig config) {
        Objects.requireNonNull(config, "config");

        final String provider = normalizeUpper(config.getString(KEY_PROVIDER, PROVIDER_NONE));

        final Map<String, String> tags = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : config.asFlatMap().entrySet()) {
            final String k = entry.getKey();
            if (!k.startsWith(KEY_TAG_PREFIX) || entry.getValue() == null) continue;

            final String tagKey = k.substring(KEY_TAG_PREFIX.length()).trim();
            final String tagValue = String.valueOf(entry.getValue()).trim();
            if (tagKey.isEmpty() || tagValue.isEmpty()) continue;

            tags.put(tagKey, tagValue);
        }

        // Port 0 asks the OS for a free port.
        final int promPort = clampInt(config.getInt(KEY_PROM_PORT, DEFAULT_PROM_PORT), 0, 65_535);
        String path = config.getString(KEY_PROM_PATH, DEFAULT_PROM_PATH).trim();
        if (!path.startsWith("/")) path = "/" + path;

        return new MetricsSettings(provider, Collections.unmodifiableMap(tags), promPort, path);
    }

    @Override
    public String toString() {
        return "MetricsSettings{providerId='" + providerId + "', commonTags=" + commonTags
                + ", prometheusPort=" + prometheusPort + ", prometheusPath='" + prometheusPath + "'}";
    }

    private static String normalizeUpper(String s) {
        if (s == null || s.isBlank()) return PROVIDER_NONE;
        return s.trim().toUpperCase(Locale.ROOT);
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
