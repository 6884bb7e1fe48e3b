/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.config;

import com.intuitivedesigns.flowkernel.compile.PipelineCompiler;
import com.intuitivedesigns.flowkernel.dispatch.PipelineExecutor;
import com.intuitivedesigns.flowkernel.dispatch.RequestDispatcher;
import com.intuitivedesigns.flowkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.flowkernel.nodes.BuiltinNodeExtension;
import com.intuitivedesigns.flowkernel.registry.NodeTypeRegistry;
import com.intuitivedesigns.flowkernel.route.EndpointBinder;
import com.intuitivedesigns.flowkernel.route.RouteTable;
import com.intuitivedesigns.flowkernel.server.ServerSettings;
import com.intuitivedesigns.flowkernel.spi.NodeExtension;
import com.intuitivedesigns.flowkernel.spi.ServicePluginRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup wiring: registry, route table and dispatcher from a {@link FlowConfig}.
 */
public final class FlowFactory {

    private static final Logger log = LoggerFactory.getLogger(FlowFactory.class);

    // Scans the classpath once per JVM.
    private static final ServicePluginRegistry<NodeExtension> EXTENSIONS =
            new ServicePluginRegistry<>(NodeExtension.class);

    private FlowFactory() {}

    /**
     * Built-in node types plus every extension listed under {@code extensions}. Returned frozen.
     */
    public static NodeTypeRegistry createRegistry(FlowConfig config) {
        final NodeTypeRegistry registry = new NodeTypeRegistry();
        new BuiltinNodeExtension().register(registry);

        for (String id : EndpointParser.extensions(config)) {
            final NodeExtension extension;
            try {
                extension = EXTENSIONS.require(id, EndpointParser.KEY_EXTENSIONS);
            } catch (IllegalArgumentException e) {
                throw new ConfigException(e.getMessage(), e);
            }
            log.info("Activating node extension {} ({})", id, extension.getClass().getName());
            extension.register(registry);
        }

        registry.freeze();
        return registry;
    }

    public static RouteTable createRouteTable(FlowConfig config, MetricsRuntime metrics) {
        final NodeTypeRegistry registry = createRegistry(config);
        final EndpointBinder binder = new EndpointBinder(new PipelineCompiler(registry, metrics));
        final RouteTable table = binder.bind(EndpointParser.dependencies(config), EndpointParser.parse(config));
        metrics.gauge("routes.bound", table.size());
        if (table.isEmpty()) {
            log.warn("No endpoints configured under '{}'", EndpointParser.KEY_API);
        }
        return table;
    }

    public static RequestDispatcher createDispatcher(RouteTable routes, ServerSettings settings, MetricsRuntime metrics) {
        return new RequestDispatcher(routes, new PipelineExecutor(metrics), metrics, settings.requestTimeoutMs());
    }

    public static void logAvailableExtensions() {
        log.info("Node extensions on classpath: {}", EXTENSIONS.availableIds());
    }
}
