/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.metrics;

import com.intuitivedesigns.flowkernel.config.FlowConfig;
import io.micrometer.core.instrument.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsSettingsTest {

    @Test
    void defaultsWhenSectionIsAbsent() {
        MetricsSettings s = MetricsSettings.from(FlowConfig.empty());

        assertThat(s.providerId).isEqualTo(MetricsSettings.PROVIDER_NONE);
        assertThat(s.commonTags).isEmpty();
        assertThat(s.prometheusPort).isEqualTo(9090);
        assertThat(s.prometheusPath).isEqualTo("/metrics");
    }

    @Test
    void readsProviderTagsAndScrapeEndpoint() {
        Map<String, Object> tags = new LinkedHashMap<>();
        tags.put("app", "flowapi");
        tags.put("env", " dev ");
        tags.put("blank", " ");
        FlowConfig config = FlowConfig.of(Map.of("metrics", Map.of(
                "provider", " prometheus ",
                "tag", tags,
                "prometheus", Map.of("port", 70_000, "path", "scrape"))));

        MetricsSettings s = MetricsSettings.from(config);

        assertThat(s.providerId).isEqualTo("PROMETHEUS");
        assertThat(s.commonTags).containsExactly(Map.entry("app", "flowapi"), Map.entry("env", "dev"));
        assertThat(s.prometheusPort).isEqualTo(65_535);
        assertThat(s.prometheusPath).isEqualTo("/scrape");
    }

    @Test
    void tagsConvertToMicrometerTags() {
        Map<String, String> raw = new LinkedHashMap<>();
        raw.put("app", "flowapi");
        raw.put(" ", "ignored");
        raw.put("region", null);

        assertThat(MetricsUtil.toTags(raw)).containsExactly(Tag.of("app", "flowapi"));
        assertThat(MetricsUtil.toTags(null)).isEmpty();
    }
}
