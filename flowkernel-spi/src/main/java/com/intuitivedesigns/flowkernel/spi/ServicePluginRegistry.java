/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.flowkernel.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Registry for SPI discovery.
 *
 * <p>The {@link ServiceLoader} classpath scan runs <b>once</b> in the constructor and the
 * result is cached, so lookups are O(1) and the registry is safe to share.</p>
 *
 * @param <T> The SPI interface type (e.g., NodeExtension.class)
 */
public final class ServicePluginRegistry<T extends ServicePlugin> {
    private final Class<T> spiType;
    private final Map<String, T> byId;

    public ServicePluginRegistry(Class<T> spiType) {
        this(spiType, resolveClassLoader());
    }

    public ServicePluginRegistry(Class<T> spiType, ClassLoader cl) {
        this.spiType = spiType;
        Map<String, T> tmp = new LinkedHashMap<>();
        ServiceLoader<T> loader = ServiceLoader.load(spiType, cl);
        for (T plugin : loader) {
            String id = PluginIds.normalize(plugin.id());
            if (id.isEmpty()) {
                throw new IllegalStateException("Plugin id() must not be blank for " + plugin.getClass().getName());
            }
            if (tmp.containsKey(id)) {
                throw new IllegalStateException("Duplicate plugin ID '" + id + "' for SPI " + spiType.getSimpleName()
                        + ". Conflict between: " + tmp.get(id).getClass().getName() + " and " + plugin.getClass().getName());
            }
            tmp.put(id, plugin);
        }
        this.byId = Collections.unmodifiableMap(tmp);
    }

    /**
     * @param configKeyName the configuration key the id came from, quoted in the error message
     * @throws IllegalArgumentException if no plugin carries the id
     */
    public T require(String id, String configKeyName) {
        String key = PluginIds.normalize(id);
        T plugin = byId.get(key);
        if (plugin == null) {
            throw new IllegalArgumentException("No " + spiType.getSimpleName() + " found for '" + configKeyName + "=" + id
                    + "'. Available options: " + byId.keySet());
        }
        return plugin;
    }

    public Set<String> availableIds() {
        return byId.keySet();
    }

    public Optional<T> get(String id) {
        return Optional.ofNullable(byId.get(PluginIds.normalize(id)));
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : ServicePluginRegistry.class.getClassLoader();
    }
}
