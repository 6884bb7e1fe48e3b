/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.server;

import com.intuitivedesigns.flowkernel.config.ConfigException;
import com.intuitivedesigns.flowkernel.config.FlowConfig;

import java.util.Objects;

/**
 * HTTP front end settings.
 *
 * <pre>
 * address: 0.0.0.0
 * port: 1979
 * ssl:    { enabled: false, keystore: server.p12, password: changeit }
 * server: { workers: 64, request-timeout-ms: 30000, backlog: 0 }
 * </pre>
 */
public record ServerSettings(String address,
                             int port,
                             int workers,
                             int backlog,
                             long requestTimeoutMs,
                             boolean sslEnabled,
                             String keystorePath,
                             String keystorePassword) {

    public static final String DEFAULT_ADDRESS = "0.0.0.0";
    public static final int DEFAULT_PORT = 1979;
    public static final int DEFAULT_WORKERS = 64;
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 30_000L;

    public ServerSettings {
        Objects.requireNonNull(address, "address");
        if (port < 0 || port > 65535) throw new ConfigException("port must be within 0..65535, got " + port);
        if (workers <= 0) throw new ConfigException("server.workers must be > 0, got " + workers);
        if (backlog < 0) throw new ConfigException("server.backlog must be >= 0, got " + backlog);
        if (requestTimeoutMs < 0) throw new ConfigException("server.request-timeout-ms must be >= 0");
        if (sslEnabled && (keystorePath == null || keystorePath.isBlank())) {
            throw new ConfigException("ssl.enabled requires ssl.keystore");
        }
    }

    public static ServerSettings from(FlowConfig config) {
        try {
            return new ServerSettings(
                    config.getString("address", DEFAULT_ADDRESS),
                    config.getInt("port", DEFAULT_PORT),
                    config.getInt("server.workers", DEFAULT_WORKERS),
                    config.getInt("server.backlog", 0),
                    config.getLong("server.request-timeout-ms", DEFAULT_REQUEST_TIMEOUT_MS),
                    config.getBoolean("ssl.enabled", false),
                    config.getString("ssl.keystore", null),
                    config.getString("ssl.password", "")
            );
        } catch (IllegalArgumentException e) {
            throw new ConfigException(e.getMessage(), e);
        }
    }

    /** Loopback, ephemeral port, small pool. */
    public static ServerSettings forTesting(int workers, long requestTimeoutMs) {
        return new ServerSettings("127.0.0.1", 0, workers, 0, requestTimeoutMs, false, null, null);
    }

    @Override
    public String toString() {
        return "ServerSettings{address=" + address + ", port=" + port + ", workers=" + workers
                + ", requestTimeoutMs=" + requestTimeoutMs + ", ssl=" + sslEnabled + "}";
    }
}
