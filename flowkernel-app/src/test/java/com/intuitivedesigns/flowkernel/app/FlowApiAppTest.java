/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.app;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.intuitivedesigns.flowkernel.config.FlowConfig;
import com.intuitivedesigns.flowkernel.config.FlowConfigLoader;
import com.intuitivedesigns.flowkernel.config.FlowFactory;
import com.intuitivedesigns.flowkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.flowkernel.route.RouteKey;
import com.intuitivedesigns.flowkernel.route.RouteTable;
import com.intuitivedesigns.flowkernel.server.ServerSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowApiAppTest {

    private final Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    private final Level originalLevel = root.getLevel();

    @AfterEach
    void restoreLevel() {
        root.setLevel(originalLevel);
    }

    @Test
    void commandLineWinsOverPropertyAndEnvironment() {
        assertThat(FlowApiApp.resolveConfigPath(new String[]{"--config", "a.yaml"}, "b.yaml", "c.yaml"))
                .isEqualTo(Path.of("a.yaml"));
        assertThat(FlowApiApp.resolveConfigPath(new String[]{"-c", "a.yaml"}, null, null))
                .isEqualTo(Path.of("a.yaml"));
        assertThat(FlowApiApp.resolveConfigPath(new String[]{"--config=a.yaml"}, null, null))
                .isEqualTo(Path.of("a.yaml"));
    }

    @Test
    void fallsBackThroughPropertyEnvironmentAndDefault() {
        String[] none = new String[0];

        assertThat(FlowApiApp.resolveConfigPath(none, "b.yaml", "c.yaml")).isEqualTo(Path.of("b.yaml"));
        assertThat(FlowApiApp.resolveConfigPath(none, " ", "c.yaml")).isEqualTo(Path.of("c.yaml"));
        assertThat(FlowApiApp.resolveConfigPath(none, null, null)).isEqualTo(Path.of(FlowApiApp.DEFAULT_CONFIG));
    }

    @Test
    void rejectsBadArguments() {
        assertThatThrownBy(() -> FlowApiApp.resolveConfigPath(new String[]{"--config"}, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Missing value");
        assertThatThrownBy(() -> FlowApiApp.resolveConfigPath(new String[]{"--port", "1"}, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown argument");
    }

    @Test
    void logLevelNamesMapOntoLogback() {
        assertThat(FlowApiApp.applyLogLevel("critical")).isEqualTo(Level.ERROR);
        assertThat(FlowApiApp.applyLogLevel("WARNING")).isEqualTo(Level.WARN);
        assertThat(FlowApiApp.applyLogLevel("trace")).isEqualTo(Level.TRACE);
        assertThat(root.getLevel()).isEqualTo(Level.TRACE);
        assertThat(FlowApiApp.applyLogLevel("verbose")).isEqualTo(Level.INFO);
        assertThat(FlowApiApp.applyLogLevel(null)).isEqualTo(Level.INFO);
    }

    @Test
    void bundledConfigurationCompiles() throws Exception {
        String yaml;
        try (InputStream in = FlowApiAppTest.class.getClassLoader().getResourceAsStream(FlowApiApp.DEFAULT_CONFIG)) {
            assertThat(in).isNotNull();
            yaml = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        FlowConfig config = FlowConfigLoader.parse(yaml);

        RouteTable routes = FlowFactory.createRouteTable(config, MetricsRuntime.noop());
        ServerSettings settings = ServerSettings.from(config);

        assertThat(settings.port()).isEqualTo(1979);
        assertThat(routes.lookup(new RouteKey(1, 0, "hello", "POST"))).isPresent();
        assertThat(routes.lookup(new RouteKey(1, 0, "slow", "GET")))
                .hasValueSatisfying(b -> assertThat(b.permits()).isPresent());
    }
}
