/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.util.Map;

public final class MetricsUtil {

    private MetricsUtil() {}

    /** Stamps {@code metrics.tag.*} onto every meter the registry creates from now on. */
    public static void applyCommonTags(MeterRegistry registry, MetricsSettings settings) {
        if (registry == null || settings == null || settings.commonTags.isEmpty()) return;
        registry.config().commonTags(toTags(settings.commonTags));
    }

    /** Entries whose key or value is blank after trimming are dropped. */
    public static Tags toTags(Map<String, String> input) {
        Tags tags = Tags.empty();
        if (input == null) return tags;

        for (Map.Entry<String, String> e : input.entrySet()) {
            final String key = trimToNull(e.getKey());
            final String value = trimToNull(e.getValue());
            if (key != null && value != null) {
                tags = tags.and(key, value);
            }
        }
        return tags;
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        final String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
