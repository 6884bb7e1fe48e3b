/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the YAML server configuration into a {@link FlowConfig}.
 */
public final class FlowConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(FlowConfigLoader.class);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() {};

    private FlowConfigLoader() {}

    public static FlowConfig load(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
        }
        log.info("Loading configuration from: {}", path.toAbsolutePath());
        final String yaml;
        try {
            yaml = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigException("Failed to read configuration file: " + path, e);
        }
        return parse(yaml, path.toString());
    }

    public static FlowConfig parse(String yaml) {
        return parse(yaml, "<inline>");
    }

    private static FlowConfig parse(String yaml, String sourceName) {
        // Jackson refuses empty content; an empty file means "all defaults".
        if (yaml == null || yaml.isBlank()) {
            log.warn("Configuration {} is empty, using defaults", sourceName);
            return FlowConfig.empty();
        }
        final Map<String, Object> document;
        try {
            document = YAML.readValue(yaml, DOCUMENT);
        } catch (IOException e) {
            throw new ConfigException("Invalid YAML configuration in " + sourceName + ": " + e.getMessage(), e);
        }
        return document == null ? FlowConfig.empty() : FlowConfig.of(document);
    }
}
