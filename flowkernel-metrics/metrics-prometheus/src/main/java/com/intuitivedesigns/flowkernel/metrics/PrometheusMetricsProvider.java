/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.metrics;

import com.sun.net.httpserver.HttpServer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Prometheus backend. Serves the scrape text on its own port so it never competes with
 * API traffic for worker threads.
 */
public final class PrometheusMetricsProvider implements MetricsProvider {

    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsProvider.class);

    @Override
    public String id() {
        return "PROMETHEUS";
    }

    @Override
    public MetricsRuntime create(MetricsSettings s) {
        if (s == null || !matches(s.providerId)) {
            return null;
        }

        final PrometheusMeterRegistry reg = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        MetricsUtil.applyCommonTags(reg, s);

        final ScrapeServer server = ScrapeServer.start(reg, s.prometheusPort, s.prometheusPath);
        log.info("Prometheus metrics active (port={}, path={})", server.port(), s.prometheusPath);

        return new MicrometerMetricsRuntime(reg, id(), server);
    }

    private static final class ScrapeServer implements AutoCloseable {
        private final HttpServer server;
        private final ExecutorService executor;

        private ScrapeServer(HttpServer server, ExecutorService executor) {
            this.server = server;
            this.executor = executor;
        }

        static ScrapeServer start(PrometheusMeterRegistry registry, int port, String path) {
            final HttpServer server;
            try {
                server = HttpServer.create(new InetSocketAddress(port), 0);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to bind Prometheus scrape endpoint on port " + port, e);
            }

            final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "metrics-http-server");
                t.setDaemon(true);
                return t;
            });
            server.setExecutor(executor);

            server.createContext(path, exchange -> {
                try {
                    final byte[] bytes = registry.scrape().getBytes(StandardCharsets.UTF_8);
                    exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
                    exchange.sendResponseHeaders(200, bytes.length);
                    try (OutputStream os = exchange.getResponseBody()) {
                        os.write(bytes);
                    }
                } finally {
                    exchange.close();
                }
            });

            server.start();
            return new ScrapeServer(server, executor);
        }

        int port() {
            return server.getAddress().getPort();
        }

        @Override
        public void close() {
            server.stop(0);
            executor.shutdownNow();
        }
    }
}
