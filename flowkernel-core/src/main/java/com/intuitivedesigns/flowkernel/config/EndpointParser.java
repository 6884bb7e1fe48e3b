/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.config;

import com.intuitivedesigns.flowkernel.model.ApiVersion;
import com.intuitivedesigns.flowkernel.model.ConcurrencyLimit;
import com.intuitivedesigns.flowkernel.model.DependencySpec;
import com.intuitivedesigns.flowkernel.model.Edge;
import com.intuitivedesigns.flowkernel.model.EndpointSpec;
import com.intuitivedesigns.flowkernel.model.NodeDef;
import com.intuitivedesigns.flowkernel.model.PipelineDef;
import com.intuitivedesigns.flowkernel.spi.PluginIds;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Validating parse step from the loosely typed document into {@link EndpointSpec} records.
 * Graph-level checks (duplicate names, dangling edges, cycles) are left to the compiler.
 */
public final class EndpointParser {

    public static final String KEY_API = "api";
    public static final String KEY_EXTENSIONS = "extensions";
    public static final String KEY_DEPENDENCIES = "dependencies";

    static final List<String> DEFAULT_METHODS = List.of("GET", "POST");
    static final long DEFAULT_MIN_SIZE = 0L;
    static final long DEFAULT_MAX_SIZE = 1_048_576L;

    private static final Set<String> KNOWN_METHODS =
            Set.of("GET", "POST", "PUT", "PATCH", "DELETE", "HEAD", "OPTIONS");

    private EndpointParser() {}

    public static List<EndpointSpec> parse(FlowConfig config) {
        final List<Object> raw = list(config.get(KEY_API), KEY_API);
        final List<EndpointSpec> out = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            final String where = KEY_API + "[" + i + "]";
            out.add(parseEndpoint(map(raw.get(i), where), where));
        }
        return List.copyOf(out);
    }

    /** Shared pre-check pipelines, in declaration order. Name uniqueness is checked by the binder. */
    public static List<DependencySpec> dependencies(FlowConfig config) {
        final List<Object> raw = list(config.get(KEY_DEPENDENCIES), KEY_DEPENDENCIES);
        final List<DependencySpec> out = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            final String where = KEY_DEPENDENCIES + "[" + i + "]";
            final Map<String, Object> m = map(raw.get(i), where);
            final String name = requireString(m, "name", where);
            final PipelineDef pipeline = parsePipeline(map(m.get("pipeline"), where + ".pipeline"), where + ".pipeline");
            out.add(new DependencySpec(name, pipeline));
        }
        return List.copyOf(out);
    }

    /** Normalized extension ids in declaration order, duplicates removed. */
    public static List<String> extensions(FlowConfig config) {
        final Set<String> ids = new LinkedHashSet<>();
        for (Object o : list(config.get(KEY_EXTENSIONS), KEY_EXTENSIONS)) {
            final String id = PluginIds.normalize(o == null ? null : String.valueOf(o));
            if (id.isEmpty()) {
                throw new ConfigException("Blank entry in '" + KEY_EXTENSIONS + "'");
            }
            ids.add(id);
        }
        return List.copyOf(ids);
    }

    static EndpointSpec parseEndpoint(Map<String, Object> m, String where) {
        final String route = normalizeRoute(requireString(m, "route", where), where);
        final ApiVersion version = parseVersion(m.get("version"), where);
        final Set<String> methods = parseMethods(m.get("methods"), where);
        final long minSize = nonNegative(m.get("min_size"), DEFAULT_MIN_SIZE, where + ".min_size");
        final long maxSize = nonNegative(m.get("max_size"), DEFAULT_MAX_SIZE, where + ".max_size");
        final PipelineDef pipeline = parsePipeline(map(m.get("pipeline"), where + ".pipeline"), where + ".pipeline");
        final ConcurrencyLimit concurrency = parseConcurrency(m.get("concurrency"), where + ".concurrency");
        final List<String> depends = parseDepends(m.get("depends"), where + ".depends");

        try {
            return new EndpointSpec(route, methods, minSize, maxSize, version, pipeline, concurrency, depends);
        } catch (IllegalArgumentException e) {
            throw new ConfigException(where + ": " + e.getMessage(), e);
        }
    }

    static PipelineDef parsePipeline(Map<String, Object> m, String where) {
        final String name = requireString(m, "name", where);

        final List<Object> rawNodes = list(m.get("node"), where + ".node");
        final List<NodeDef> nodes = new ArrayList<>(rawNodes.size());
        for (int i = 0; i < rawNodes.size(); i++) {
            final String nodeWhere = where + ".node[" + i + "]";
            final Map<String, Object> n = map(rawNodes.get(i), nodeWhere);
            nodes.add(new NodeDef(
                    requireString(n, "name", nodeWhere),
                    requireString(n, "type", nodeWhere),
                    requireString(n, "version", nodeWhere),
                    NodeConfig.of(map(n.get("config"), nodeWhere + ".config"))
            ));
        }

        final List<Edge> edges = new ArrayList<>();
        for (Object line : list(m.get("digraph"), where + ".digraph")) {
            try {
                edges.addAll(Edge.parse(line == null ? null : String.valueOf(line)));
            } catch (IllegalArgumentException e) {
                throw new ConfigException(where + ".digraph: " + e.getMessage(), e);
            }
        }

        return new PipelineDef(name, nodes, edges);
    }

    static String normalizeRoute(String raw, String where) {
        String r = raw.trim();
        while (r.startsWith("/")) r = r.substring(1);
        while (r.endsWith("/")) r = r.substring(0, r.length() - 1);
        if (r.isEmpty()) {
            throw new ConfigException(where + ".route must not be empty");
        }
        return r;
    }

    private static ApiVersion parseVersion(Object raw, String where) {
        try {
            return ApiVersion.parse(raw == null ? null : String.valueOf(raw));
        } catch (IllegalArgumentException e) {
            throw new ConfigException(where + ".version: " + e.getMessage(), e);
        }
    }

    private static Set<String> parseMethods(Object raw, String where) {
        if (raw == null) {
            return new LinkedHashSet<>(DEFAULT_METHODS);
        }
        final Set<String> methods = new LinkedHashSet<>();
        for (Object o : list(raw, where + ".methods")) {
            final String verb = o == null ? "" : String.valueOf(o).trim().toUpperCase(Locale.ROOT);
            if (!KNOWN_METHODS.contains(verb)) {
                throw new ConfigException(where + ".methods: unsupported HTTP method '" + o + "'");
            }
            methods.add(verb);
        }
        if (methods.isEmpty()) {
            throw new ConfigException(where + ".methods must not be empty");
        }
        return methods;
    }

    private static List<String> parseDepends(Object raw, String where) {
        final Set<String> names = new LinkedHashSet<>();
        for (Object o : list(raw, where)) {
            final String name = o == null ? "" : String.valueOf(o).trim();
            if (name.isEmpty()) {
                throw new ConfigException("Blank entry in " + where);
            }
            names.add(name);
        }
        return List.copyOf(names);
    }

    private static ConcurrencyLimit parseConcurrency(Object raw, String where) {
        if (raw == null) return null;
        final NodeConfig c = NodeConfig.of(map(raw, where));
        try {
            return new ConcurrencyLimit(c.getInt("limit", 0), c.getLong("wait-ms", 0L));
        } catch (IllegalArgumentException e) {
            throw new ConfigException(where + ": " + e.getMessage(), e);
        }
    }

    private static long nonNegative(Object raw, long defaultValue, String where) {
        if (raw == null) return defaultValue;
        final long v;
        if (raw instanceof Number n) {
            v = n.longValue();
        } else {
            try {
                v = Long.parseLong(String.valueOf(raw).trim());
            } catch (NumberFormatException e) {
                throw new ConfigException(where + " must be an integer, got '" + raw + "'", e);
            }
        }
        if (v < 0) {
            throw new ConfigException(where + " must be >= 0, got " + v);
        }
        return v;
    }

    private static String requireString(Map<String, Object> m, String key, String where) {
        final Object v = m.get(key);
        final String s = v == null ? "" : String.valueOf(v).trim();
        if (s.isEmpty()) {
            throw new ConfigException("Missing required key '" + key + "' in " + where);
        }
        return s;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(Object raw, String where) {
        if (raw == null) return Map.of();
        if (raw instanceof Map<?, ?> m) return (Map<String, Object>) m;
        throw new ConfigException(where + " must be a mapping");
    }

    @SuppressWarnings("unchecked")
    private static List<Object> list(Object raw, String where) {
        if (raw == null) return List.of();
        if (raw instanceof List<?> l) return (List<Object>) l;
        throw new ConfigException(where + " must be a list");
    }
}
