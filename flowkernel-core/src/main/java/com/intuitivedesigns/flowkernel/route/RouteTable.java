/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.route;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable lookup from {@code (major, minor, route, method)} to a {@link RouteBinding}.
 * Built once by {@link EndpointBinder}; read concurrently without locks.
 */
public final class RouteTable {

    private final Map<RouteKey, RouteBinding> bindings;
    private final Map<String, Set<String>> methodsByPath;

    RouteTable(Map<RouteKey, RouteBinding> bindings) {
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
        final Map<String, Set<String>> byPath = new LinkedHashMap<>();
        for (RouteKey key : bindings.keySet()) {
            byPath.computeIfAbsent(key.path(), p -> new TreeSet<>()).add(key.method());
        }
        byPath.replaceAll((p, m) -> Collections.unmodifiableSet(m));
        this.methodsByPath = Collections.unmodifiableMap(byPath);
    }

    public Optional<RouteBinding> lookup(RouteKey key) {
        return Optional.ofNullable(bindings.get(key));
    }

    /** Methods bound for the path of {@code key}, ignoring its method. Empty if the path is unknown. */
    public Set<String> allowedMethods(RouteKey key) {
        return methodsByPath.getOrDefault(key.path(), Set.of());
    }

    /** Largest {@code max_size} of any bound endpoint; 0 for an empty table. */
    public long largestMaxSize() {
        long max = 0;
        for (RouteBinding b : bindings.values()) {
            max = Math.max(max, b.endpoint().maxSize());
        }
        return max;
    }

    public Set<RouteKey> keys() {
        return bindings.keySet();
    }

    public int size() {
        return bindings.size();
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }
}
