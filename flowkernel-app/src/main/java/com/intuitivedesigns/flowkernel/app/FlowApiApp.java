/*
 * Copyright 2025 Steven Lopez
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.app;

import ch.qos.logback.classic.Level;
import com.intuitivedesigns.flowkernel.compile.CompilationException;
import com.intuitivedesigns.flowkernel.config.ConfigException;
import com.intuitivedesigns.flowkernel.config.FlowConfig;
import com.intuitivedesigns.flowkernel.config.FlowConfigLoader;
import com.intuitivedesigns.flowkernel.config.FlowFactory;
import com.intuitivedesigns.flowkernel.dispatch.RequestDispatcher;
import com.intuitivedesigns.flowkernel.metrics.MetricsFactory;
import com.intuitivedesigns.flowkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.flowkernel.metrics.MetricsSettings;
import com.intuitivedesigns.flowkernel.route.RouteTable;
import com.intuitivedesigns.flowkernel.server.FlowApiServer;
import com.intuitivedesigns.flowkernel.server.ServerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

public final class FlowApiApp {

    private static final Logger log = LoggerFactory.getLogger(FlowApiApp.class);

    // --- Config path resolution ---
    static final String SYS_PROP_CONFIG = "fk.config.path";
    static final String ENV_CONFIG = "FK_CONFIG_PATH";
    static final String DEFAULT_CONFIG = "flowapi-server.yaml";

    private static final String CFG_LOG_LEVEL = "log.level";

    private FlowApiApp() {}

    public static void main(String[] args) {
        final Path configPath;
        try {
            configPath = resolveConfigPath(args, System.getProperty(SYS_PROP_CONFIG), System.getenv(ENV_CONFIG));
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Usage: FlowApiApp [--config|-c <file>]");
            System.exit(1);
            return;
        }

        log.info("=== Booting FlowAPI server ===");

        MetricsRuntime metrics = null;
        FlowApiServer server = null;

        final CountDownLatch shutdownLatch = new CountDownLatch(1);
        final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

        try {
            // 1. Configuration
            final FlowConfig config = FlowConfigLoader.load(configPath);
            applyLogLevel(config.getString(CFG_LOG_LEVEL, "info"));
            final ServerSettings settings = ServerSettings.from(config);
            log.info("CONFIG: {}", settings);

            // 2. Metrics
            metrics = MetricsFactory.init(MetricsSettings.from(config));

            // 3. Registry, pipelines, routes
            FlowFactory.logAvailableExtensions();
            final RouteTable routes = FlowFactory.createRouteTable(config, metrics);
            final RequestDispatcher dispatcher = FlowFactory.createDispatcher(routes, settings, metrics);
            log.info("Route table ready: {} routes", routes.size());

            // 4. Shutdown hook
            server = new FlowApiServer(settings, dispatcher, routes.largestMaxSize());
            final FlowApiServer finalServer = server;
            final MetricsRuntime finalMetrics = metrics;
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (!shutdownStarted.compareAndSet(false, true)) {
                    return;
                }
                log.info("Shutdown signal received.");
                try {
                    finalServer.stop();
                } finally {
                    closeQuietly(finalMetrics);
                    shutdownLatch.countDown();
                }
            }, "fk-shutdown"));

            // 5. Launch
            server.start();
            shutdownLatch.await();
        } catch (ConfigException | CompilationException e) {
            log.error("Invalid configuration {}: {}", configPath, e.getMessage());
            shutdown(shutdownStarted, server, metrics);
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown(shutdownStarted, server, metrics);
        } catch (Throwable t) {
            log.error("Fatal application error", t);
            shutdown(shutdownStarted, server, metrics);
            System.exit(1);
        }
    }

    /**
     * {@code --config}/{@code -c} wins, then the system property, then the environment, then the default.
     *
     * @throws IllegalArgumentException on an unknown argument or a missing option value
     */
    static Path resolveConfigPath(String[] args, String sysProp, String env) {
        String fromArgs = null;
        for (int i = 0; i < args.length; i++) {
            final String a = args[i];
            if ("--config".equals(a) || "-c".equals(a)) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Missing value for " + a);
                }
                fromArgs = args[++i];
            } else if (a.startsWith("--config=")) {
                fromArgs = a.substring("--config=".length());
            } else {
                throw new IllegalArgumentException("Unknown argument: " + a);
            }
        }
        if (notBlank(fromArgs)) return Path.of(fromArgs.trim());
        if (notBlank(sysProp)) return Path.of(sysProp.trim());
        if (notBlank(env)) return Path.of(env.trim());
        return Path.of(DEFAULT_CONFIG);
    }

    private static final Map<String, Level> LEVELS = Map.of(
            "critical", Level.ERROR,
            "error", Level.ERROR,
            "warning", Level.WARN,
            "warn", Level.WARN,
            "info", Level.INFO,
            "debug", Level.DEBUG,
            "trace", Level.TRACE
    );

    /** Maps the configured level name onto the Logback root logger. Unknown names fall back to INFO. */
    static Level applyLogLevel(String name) {
        final String key = name == null ? "info" : name.trim().toLowerCase(Locale.ROOT);
        Level level = LEVELS.get(key);
        if (level == null) {
            log.warn("Unknown log.level '{}', using info", name);
            level = Level.INFO;
        }
        final org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(level);
        } else {
            log.warn("SLF4J is not bound to Logback; log.level ignored");
        }
        return level;
    }

    private static void shutdown(AtomicBoolean shutdownStarted, FlowApiServer server, MetricsRuntime metrics) {
        if (!shutdownStarted.compareAndSet(false, true)) return;
        try {
            if (server != null) server.stop();
        } finally {
            closeQuietly(metrics);
        }
    }

    private static void closeQuietly(AutoCloseable resource) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Failed to close {}: {}", resource.getClass().getSimpleName(), e.getMessage());
        }
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
