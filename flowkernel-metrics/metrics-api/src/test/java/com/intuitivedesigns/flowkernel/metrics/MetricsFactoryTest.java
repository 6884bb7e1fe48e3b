/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.metrics;

import com.intuitivedesigns.flowkernel.config.FlowConfig;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsFactoryTest {

    @Test
    void noneDisablesMetrics() {
        MetricsRuntime rt = MetricsFactory.init(MetricsSettings.from(FlowConfig.empty()));

        assertThat(rt).isSameAs(MetricsRuntime.noop());
        assertThat(rt.enabled()).isFalse();
    }

    @Test
    void unmatchedProviderFallsBackToNoop() {
        FlowConfig config = FlowConfig.of(Map.of("metrics", Map.of("provider", "statsd")));

        MetricsRuntime rt = MetricsFactory.init(MetricsSettings.from(config));

        assertThat(rt).isSameAs(MetricsRuntime.noop());
    }
}
