/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.registry;

import com.intuitivedesigns.flowkernel.compile.CompilationException;
import com.intuitivedesigns.flowkernel.spi.NodePlugin;
import com.intuitivedesigns.flowkernel.spi.NodeTypeRegistrar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps {@code (type, version)} to the {@link NodePlugin} that builds operators for it.
 *
 * <p>Written during startup only. After {@link #freeze()} the registry is read-only and
 * safe to share between threads without locking.</p>
 */
public final class NodeTypeRegistry implements NodeTypeRegistrar {

    private static final Logger log = LoggerFactory.getLogger(NodeTypeRegistry.class);

    private final Map<NodeTypeKey, NodePlugin> plugins = new ConcurrentHashMap<>();
    private volatile boolean frozen;

    @Override
    public void register(NodePlugin plugin) {
        Objects.requireNonNull(plugin, "plugin");
        if (frozen) {
            throw new IllegalStateException("Node type registry is frozen; cannot register " + plugin.type() + "@" + plugin.version());
        }
        final NodeTypeKey key = new NodeTypeKey(plugin.type(), plugin.version());
        final NodePlugin existing = plugins.putIfAbsent(key, plugin);
        if (existing != null) {
            throw new CompilationException(CompilationException.Kind.DUPLICATE_NODE_TYPE,
                    "Node type " + key + " is already registered by " + existing.getClass().getName()
                            + " (conflict with " + plugin.getClass().getName() + ")");
        }
        log.debug("Registered node type {} -> {}", key, plugin.getClass().getName());
    }

    /**
     * @throws CompilationException with {@code UNKNOWN_NODE_TYPE} if nothing is registered for the pair
     */
    public NodePlugin resolve(String type, String version) {
        final NodePlugin plugin = plugins.get(new NodeTypeKey(type, version));
        if (plugin == null) {
            throw new CompilationException(CompilationException.Kind.UNKNOWN_NODE_TYPE,
                    "Unknown node type '" + type + "' version '" + version + "'. Available: " + registeredTypes());
        }
        return plugin;
    }

    public boolean contains(String type, String version) {
        return plugins.containsKey(new NodeTypeKey(type, version));
    }

    public void freeze() {
        if (!frozen) {
            frozen = true;
            log.info("Node type registry frozen with {} types: {}", plugins.size(), registeredTypes());
        }
    }

    public boolean isFrozen() {
        return frozen;
    }

    /** Sorted for stable log and error output. */
    public List<NodeTypeKey> registeredTypes() {
        final List<NodeTypeKey> keys = new ArrayList<>(plugins.keySet());
        keys.sort((a, b) -> a.toString().compareTo(b.toString()));
        return Collections.unmodifiableList(keys);
    }
}
