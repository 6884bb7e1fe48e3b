/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.spi;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ServicePluginRegistryTest {

    @Test
    void testNormalizeTrimsAndUppercases() {
        assertEquals("EXAMPLE", PluginIds.normalize("  example "));
        assertEquals("", PluginIds.normalize(null));
    }

    @Test
    void testEmptyClasspathHasNoPlugins() {
        ServicePluginRegistry<NodeExtension> registry = new ServicePluginRegistry<>(NodeExtension.class);

        assertTrue(registry.availableIds().isEmpty());
        assertTrue(registry.get("example").isEmpty());
    }

    @Test
    void testRequireNamesTheConfigKey() {
        ServicePluginRegistry<NodeExtension> registry = new ServicePluginRegistry<>(NodeExtension.class);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> registry.require("example", "extensions"));
        assertTrue(e.getMessage().contains("extensions=example"), e.getMessage());
        assertTrue(e.getMessage().contains("NodeExtension"), e.getMessage());
    }
}
