/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.config;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Operator-specific parameters of one pipeline node, as declared under {@code config:}.
 * Deeply immutable; shared by every execution of the node.
 */
public final class NodeConfig {

    private static final NodeConfig EMPTY = new NodeConfig(Map.of());

    private final Map<String, Object> values;

    private NodeConfig(Map<String, Object> values) {
        this.values = values;
    }

    public static NodeConfig of(Map<?, ?> raw) {
        if (raw == null || raw.isEmpty()) return EMPTY;
        return new NodeConfig(ConfigValues.freezeMap(raw));
    }

    public static NodeConfig empty() {
        return EMPTY;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public String getString(String key, String defaultValue) {
        return ConfigValues.asString(values.get(key), defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        return ConfigValues.asInt(key, values.get(key), defaultValue);
    }

    public long getLong(String key, long defaultValue) {
        return ConfigValues.asLong(key, values.get(key), defaultValue);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        return ConfigValues.asBoolean(key, values.get(key), defaultValue);
    }

    /** Nested mapping, empty when absent. */
    public Map<String, Object> getMap(String key) {
        return ConfigValues.asMap(key, values.get(key));
    }

    /** Nested list, empty when absent. */
    public List<Object> getList(String key) {
        return ConfigValues.asList(key, values.get(key));
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NodeConfig other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "NodeConfig" + values;
    }
}
