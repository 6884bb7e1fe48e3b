/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions shared by {@link FlowConfig} and {@link NodeConfig}. YAML scalars arrive either
 * as their natural Java type or as strings, so every accessor accepts both.
 */
final class ConfigValues {

    private ConfigValues() {}

    /** Recursively copies maps and lists into unmodifiable structures. Null values are kept. */
    static Object freeze(Object value) {
        if (value instanceof Map<?, ?> m) {
            return freezeMap(m);
        }
        if (value instanceof List<?> l) {
            List<Object> out = new ArrayList<>(l.size());
            for (Object o : l) {
                out.add(freeze(o));
            }
            return Collections.unmodifiableList(out);
        }
        return value;
    }

    static Map<String, Object> freezeMap(Map<?, ?> m) {
        if (m == null || m.isEmpty()) return Map.of();
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : m.entrySet()) {
            out.put(String.valueOf(e.getKey()), freeze(e.getValue()));
        }
        return Collections.unmodifiableMap(out);
    }

    static String asString(Object v, String defaultValue) {
        return v == null ? defaultValue : String.valueOf(v);
    }

    static long asLong(String key, Object v, long defaultValue) {
        if (v == null) return defaultValue;
        if (v instanceof Number n) return n.longValue();
        String s = String.valueOf(v).trim();
        if (s.isEmpty()) return defaultValue;
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config key '" + key + "' must be an integer, got '" + s + "'", e);
        }
    }

    static int asInt(String key, Object v, int defaultValue) {
        long l = asLong(key, v, defaultValue);
        if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Config key '" + key + "' is out of int range: " + l);
        }
        return (int) l;
    }

    static boolean asBoolean(String key, Object v, boolean defaultValue) {
        if (v == null) return defaultValue;
        if (v instanceof Boolean b) return b;
        String s = String.valueOf(v).trim();
        if (s.equalsIgnoreCase("true")) return true;
        if (s.equalsIgnoreCase("false")) return false;
        throw new IllegalArgumentException("Config key '" + key + "' must be true or false, got '" + s + "'");
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> asMap(String key, Object v) {
        if (v == null) return Map.of();
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        throw new IllegalArgumentException("Config key '" + key + "' must be a mapping");
    }

    @SuppressWarnings("unchecked")
    static List<Object> asList(String key, Object v) {
        if (v == null) return List.of();
        if (v instanceof List<?> l) return (List<Object>) l;
        throw new IllegalArgumentException("Config key '" + key + "' must be a list");
    }
}
