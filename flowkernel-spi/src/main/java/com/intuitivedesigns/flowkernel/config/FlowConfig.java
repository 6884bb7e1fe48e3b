/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parsed server configuration document.
 *
 * <p>Values are addressed by dotted paths over the nested document, so {@code "server.workers"}
 * reads {@code workers} under {@code server}. Instances are immutable and passed explicitly;
 * there is no process-wide singleton.</p>
 */
public final class FlowConfig {

    private final Map<String, Object> root;

    private FlowConfig(Map<String, Object> root) {
        this.root = root;
    }

    public static FlowConfig of(Map<?, ?> document) {
        return new FlowConfig(ConfigValues.freezeMap(document));
    }

    public static FlowConfig empty() {
        return new FlowConfig(Map.of());
    }

    public Object get(String path) {
        Object current = root;
        for (String part : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> m)) {
                return null;
            }
            current = m.get(part);
        }
        return current;
    }

    public String getString(String path, String defaultValue) {
        return ConfigValues.asString(get(path), defaultValue);
    }

    public int getInt(String path, int defaultValue) {
        return ConfigValues.asInt(path, get(path), defaultValue);
    }

    public long getLong(String path, long defaultValue) {
        return ConfigValues.asLong(path, get(path), defaultValue);
    }

    public boolean getBoolean(String path, boolean defaultValue) {
        return ConfigValues.asBoolean(path, get(path), defaultValue);
    }

    public List<Object> getList(String path) {
        return ConfigValues.asList(path, get(path));
    }

    public FlowConfig section(String path) {
        return new FlowConfig(ConfigValues.asMap(path, get(path)));
    }

    public boolean hasPath(String path) {
        return get(path) != null;
    }

    public Set<String> keys() {
        return root.keySet();
    }

    /**
     * Flattens scalar leaves into dotted keys, e.g. {@code metrics.tag.app -> flowapi}.
     * Lists are kept as single values.
     */
    public Map<String, Object> asFlatMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        flatten("", root, out);
        return out;
    }

    private static void flatten(String prefix, Map<?, ?> map, Map<String, Object> out) {
        for (Map.Entry<?, ?> e : map.entrySet()) {
            String key = prefix.isEmpty() ? String.valueOf(e.getKey()) : prefix + "." + e.getKey();
            if (e.getValue() instanceof Map<?, ?> nested) {
                flatten(key, nested, out);
            } else {
                out.put(key, e.getValue());
            }
        }
    }
}
