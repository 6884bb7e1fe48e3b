/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.flowkernel.dispatch.DispatchRequest;
import com.intuitivedesigns.flowkernel.dispatch.DispatchResponse;
import com.intuitivedesigns.flowkernel.dispatch.RequestDispatcher;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.sun.net.httpserver.HttpsConfigurator;
import com.sun.net.httpserver.HttpsServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP(S) front end on the JDK server. Translates exchanges into {@link DispatchRequest}s and
 * writes {@link DispatchResponse}s back as JSON.
 *
 * <p>Requests run on a fixed pool of platform threads, so a blocking node holds one worker.</p>
 */
public final class FlowApiServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FlowApiServer.class);

    private static final String JSON_CT = "application/json";
    private static final int MAX_BUFFERED_BODY = Integer.MAX_VALUE - 8;

    private final ServerSettings settings;
    private final RequestDispatcher dispatcher;
    private final int bodyReadLimit;
    private final ObjectMapper json = new ObjectMapper();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private HttpServer server;
    private ExecutorService workers;

    /**
     * @param largestMaxSize the largest body any endpoint accepts; reading stops one byte past it
     */
    public FlowApiServer(ServerSettings settings, RequestDispatcher dispatcher, long largestMaxSize) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.bodyReadLimit = (int) Math.min(MAX_BUFFERED_BODY, Math.max(0L, largestMaxSize) + 1L);
    }

    public void start() throws IOException {
        if (!running.compareAndSet(false, true)) return;

        final InetSocketAddress bind = new InetSocketAddress(settings.address(), settings.port());
        this.server = settings.sslEnabled() ? createHttps(bind) : HttpServer.create(bind, settings.backlog());
        this.workers = Executors.newFixedThreadPool(settings.workers(), new WorkerThreadFactory());
        server.setExecutor(workers);
        server.createContext("/", this::handle);
        server.start();

        log.info("FlowAPI server listening on {}://{}:{} with {} workers",
                settings.sslEnabled() ? "https" : "http", settings.address(), port(), settings.workers());
    }

    /** Actual bound port; differs from the configured one when that was 0. */
    public int port() {
        if (server == null) throw new IllegalStateException("Server not started");
        return server.getAddress().getPort();
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) return;
        log.info("Stopping FlowAPI server...");
        server.stop(1);
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Workers did not finish in time, interrupting in-flight requests");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        log.info("FlowAPI server stopped");
    }

    @Override
    public void close() {
        stop();
    }

    private void handle(HttpExchange exchange) {
        try {
            final DispatchRequest request = toRequest(exchange);
            write(exchange, dispatcher.dispatch(request));
        } catch (IOException e) {
            log.warn("I/O error on {} {}: {}", exchange.getRequestMethod(), exchange.getRequestURI(), e.getMessage());
        } catch (RuntimeException e) {
            final String errorId = UUID.randomUUID().toString();
            log.error("Unhandled error on {} {} [errorId={}]", exchange.getRequestMethod(), exchange.getRequestURI(), errorId, e);
            writeInternalError(exchange, errorId);
        } finally {
            exchange.close();
        }
    }

    private void writeInternalError(HttpExchange exchange, String errorId) {
        try {
            writeBytes(exchange, 500, Map.of(),
                    json.writeValueAsBytes(Map.of("error", "INTERNAL", "message", "Requested process failed", "id", errorId)));
        } catch (IOException io) {
            log.warn("Could not send error response [errorId={}]: {}", errorId, io.getMessage());
        }
    }

    private DispatchRequest toRequest(HttpExchange exchange) throws IOException {
        final Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> h : exchange.getRequestHeaders().entrySet()) {
            if (h.getKey() != null) {
                headers.put(h.getKey(), String.join(", ", h.getValue()));
            }
        }
        final InetSocketAddress remote = exchange.getRemoteAddress();
        final String client = remote == null ? null : remote.getHostString() + ":" + remote.getPort();

        final byte[] body;
        try (InputStream in = exchange.getRequestBody()) {
            body = readBody(in, bodyReadLimit);
        }
        return new DispatchRequest(
                exchange.getRequestMethod(),
                decodePath(exchange.getRequestURI().getRawPath()),
                headers,
                parseQuery(exchange.getRequestURI().getRawQuery()),
                body,
                client);
    }

    private void write(HttpExchange exchange, DispatchResponse response) throws IOException {
        final byte[] bytes;
        try {
            bytes = json.writeValueAsBytes(response.body());
        } catch (JsonProcessingException e) {
            // Nothing has been sent yet, so the caller still gets a status.
            final String errorId = UUID.randomUUID().toString();
            log.error("Response body for {} {} is not serializable [errorId={}]",
                    exchange.getRequestMethod(), exchange.getRequestURI(), errorId, e);
            writeInternalError(exchange, errorId);
            return;
        }
        writeBytes(exchange, response.status(), response.headers(), bytes);
    }

    private static void writeBytes(HttpExchange exchange, int status, Map<String, String> headers, byte[] bytes) throws IOException {
        final Headers out = exchange.getResponseHeaders();
        headers.forEach(out::set);
        out.set("Content-Type", JSON_CT);

        final boolean noBody = status == 204 || status == 304 || "HEAD".equalsIgnoreCase(exchange.getRequestMethod());
        exchange.sendResponseHeaders(status, noBody ? -1 : bytes.length);
        if (!noBody) {
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    /** Reads at most {@code limit} bytes; anything beyond is left unread. */
    static byte[] readBody(InputStream in, int limit) throws IOException {
        final ByteArrayOutputStream buf = new ByteArrayOutputStream();
        final byte[] chunk = new byte[8192];
        int remaining = limit;
        while (remaining > 0) {
            final int n = in.read(chunk, 0, Math.min(chunk.length, remaining));
            if (n < 0) break;
            buf.write(chunk, 0, n);
            remaining -= n;
        }
        return buf.toByteArray();
    }

    /**
     * Percent-decodes a raw path as UTF-8. Unlike query strings, {@code '+'} stays literal.
     * Malformed escapes are left as they are and simply match no route.
     */
    static String decodePath(String rawPath) {
        if (rawPath == null || rawPath.indexOf('%') < 0) return rawPath;
        try {
            return URLDecoder.decode(rawPath.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("Undecodable path '{}': {}", rawPath, e.getMessage());
            return rawPath;
        }
    }

    /** Repeated names collect into a list in arrival order. */
    @SuppressWarnings("unchecked")
    static Map<String, Object> parseQuery(String rawQuery) {
        final Map<String, Object> out = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) return out;
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) continue;
            final int eq = pair.indexOf('=');
            final String name = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
            final String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            final Object existing = out.get(name);
            if (existing == null) {
                out.put(name, value);
            } else if (existing instanceof List<?> list) {
                ((List<Object>) list).add(value);
            } else {
                final List<Object> values = new ArrayList<>();
                values.add(existing);
                values.add(value);
                out.put(name, values);
            }
        }
        return out;
    }

    private HttpsServer createHttps(InetSocketAddress bind) throws IOException {
        final HttpsServer https = HttpsServer.create(bind, settings.backlog());
        https.setHttpsConfigurator(new HttpsConfigurator(sslContext(settings.keystorePath(), settings.keystorePassword())));
        return https;
    }

    static SSLContext sslContext(String keystorePath, String password) throws IOException {
        final char[] secret = password == null ? new char[0] : password.toCharArray();
        try (InputStream in = Files.newInputStream(Path.of(keystorePath))) {
            final KeyStore ks = KeyStore.getInstance("PKCS12");
            ks.load(in, secret);
            final KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            kmf.init(ks, secret);
            final SSLContext ctx = SSLContext.getInstance("TLS");
            ctx.init(kmf.getKeyManagers(), null, null);
            return ctx;
        } catch (GeneralSecurityException e) {
            throw new IOException("Failed to initialise TLS from keystore " + keystorePath, e);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            final Thread t = new Thread(r, "flowapi-worker-" + seq.incrementAndGet());
            t.setDaemon(false);
            return t;
        }
    }
}
