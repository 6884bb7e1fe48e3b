/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.flowkernel.compile.CompiledPipeline;
import com.intuitivedesigns.flowkernel.dispatch.DispatchException.Status;
import com.intuitivedesigns.flowkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.flowkernel.model.EndpointSpec;
import com.intuitivedesigns.flowkernel.route.RouteBinding;
import com.intuitivedesigns.flowkernel.route.RouteKey;
import com.intuitivedesigns.flowkernel.route.RouteTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Routes one request to its compiled pipeline and turns the outcome into a {@link DispatchResponse}.
 *
 * <p>Every rejection that does not need the pipeline (unknown route, wrong method, size bounds,
 * malformed body, saturation) happens before any node runs. Node failures are logged with an
 * opaque error id which is the only detail returned to the caller.</p>
 */
public final class RequestDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

    static final String FAILURE_MESSAGE = "Requested process failed";

    // Request headers sit under data.headers too; these are never copied onto the response.
    private static final Set<String> RESERVED_RESPONSE_HEADERS =
            Set.of("content-length", "content-type", "transfer-encoding", "connection", "host", "date", "keep-alive");

    private final RouteTable routes;
    private final PipelineExecutor executor;
    private final MetricsRuntime metrics;
    private final long requestTimeoutMs;
    private final ObjectMapper json;

    public RequestDispatcher(RouteTable routes, PipelineExecutor executor, MetricsRuntime metrics, long requestTimeoutMs) {
        this.routes = Objects.requireNonNull(routes, "routes");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.noop();
        if (requestTimeoutMs < 0) throw new IllegalArgumentException("server.request-timeout-ms must be >= 0");
        this.requestTimeoutMs = requestTimeoutMs;
        this.json = new ObjectMapper();
    }

    public DispatchResponse dispatch(DispatchRequest request) {
        Objects.requireNonNull(request, "request");
        final long startNanos = System.nanoTime();
        metrics.counter("dispatch.requests");

        DispatchResponse response;
        try {
            response = handle(request);
        } catch (DispatchException e) {
            if (log.isDebugEnabled()) {
                log.debug("{} {} rejected: {} {}", request.method(), request.path(), e.status(), e.getMessage());
            }
            response = DispatchResponse.error(e.status(), e.getMessage(), null, e.headers());
        }

        metrics.counter("dispatch.status." + response.status());
        metrics.timer("dispatch.latency", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        return response;
    }

    private DispatchResponse handle(DispatchRequest request) {
        final RouteKey key = parsePath(request.method(), request.path())
                .orElseThrow(() -> new DispatchException(Status.NO_SUCH_ENDPOINT, "No endpoint at " + request.path()));

        final Optional<RouteBinding> found = routes.lookup(key);
        if (found.isEmpty()) {
            final Set<String> allowed = routes.allowedMethods(key);
            if (allowed.isEmpty()) {
                throw new DispatchException(Status.NO_SUCH_ENDPOINT, "No endpoint at " + request.path());
            }
            throw new DispatchException(Status.METHOD_NOT_ALLOWED,
                    "Method " + request.method() + " not allowed for " + request.path(),
                    Map.of("Allow", String.join(", ", allowed)));
        }

        final RouteBinding binding = found.get();
        final EndpointSpec endpoint = binding.endpoint();

        final int size = request.body().length;
        if (size < endpoint.minSize()) {
            throw new DispatchException(Status.PAYLOAD_TOO_SMALL,
                    "Request body of " + size + " bytes is below the minimum of " + endpoint.minSize());
        }
        if (size > endpoint.maxSize()) {
            throw new DispatchException(Status.PAYLOAD_TOO_LARGE,
                    "Request body of " + size + " bytes exceeds the maximum of " + endpoint.maxSize());
        }

        final Map<String, Object> seed = seed(request, key);

        final Semaphore permits = binding.permits().orElse(null);
        if (permits != null) {
            acquire(permits, endpoint, key);
        }
        try {
            return run(binding, seed);
        } finally {
            if (permits != null) {
                permits.release();
            }
        }
    }

    private DispatchResponse run(RouteBinding binding, Map<String, Object> seed) {
        final String requestId = UUID.randomUUID().toString();
        final ExecutionDeadline deadline = ExecutionDeadline.afterMillis(requestTimeoutMs);

        // Each dependency walks its own copy of the request data; only failure is observed.
        for (CompiledPipeline dependency : binding.dependencies()) {
            final Optional<DispatchResponse> rejected =
                    walk(dependency, new ExecutionContext(requestId, copyOf(seed), deadline));
            if (rejected.isPresent()) {
                return rejected.get();
            }
        }

        final ExecutionContext ctx = new ExecutionContext(requestId, seed, deadline);
        final Optional<DispatchResponse> rejected = walk(binding.pipeline(), ctx);
        if (rejected.isPresent()) {
            return rejected.get();
        }

        final DispatchResponse response;
        try {
            response = toResponse(ctx.data());
            // Writes nowhere; fails here rather than after the transport has sent a status line.
            json.writeValue(OutputStream.nullOutputStream(), response.body());
        } catch (IllegalArgumentException e) {
            log.error("Pipeline '{}' produced an unusable response [errorId={}]: {}",
                    binding.pipeline().name(), requestId, e.getMessage());
            return DispatchResponse.error(Status.PIPELINE_FAILED, FAILURE_MESSAGE, requestId, Map.of());
        } catch (IOException e) {
            log.error("Pipeline '{}' produced a body that cannot be written as JSON [errorId={}]: {}",
                    binding.pipeline().name(), requestId, e.getMessage());
            return DispatchResponse.error(Status.PIPELINE_FAILED, FAILURE_MESSAGE, requestId, Map.of());
        }
        return response;
    }

    /** Empty when the walk completed, otherwise the error response to send. */
    private Optional<DispatchResponse> walk(CompiledPipeline pipeline, ExecutionContext ctx) {
        final String requestId = ctx.requestId();
        try {
            executor.execute(pipeline, ctx);
            return Optional.empty();
        } catch (PipelineExecutionException e) {
            log.error("Pipeline '{}' failed at node '{}' ({}) [errorId={}]",
                    e.pipeline(), e.nodeName(), e.nodeType(), requestId, e.getCause());
            return Optional.of(DispatchResponse.error(Status.PIPELINE_FAILED, FAILURE_MESSAGE, requestId, Map.of()));
        } catch (PipelineCancelledException e) {
            if (e.reason() == PipelineCancelledException.Reason.DEADLINE) {
                log.warn("Pipeline '{}' exceeded {} ms before node '{}' [errorId={}]",
                        pipeline.name(), requestTimeoutMs, e.nextNode(), requestId);
                return Optional.of(DispatchResponse.error(Status.REQUEST_TIMEOUT, "Request timed out", requestId, Map.of()));
            }
            log.warn("Pipeline '{}' interrupted before node '{}' [errorId={}]",
                    pipeline.name(), e.nextNode(), requestId);
            return Optional.of(DispatchResponse.error(Status.CANCELLED, "Request was cancelled", requestId, Map.of()));
        }
    }

    private void acquire(Semaphore permits, EndpointSpec endpoint, RouteKey key) {
        final long waitMs = endpoint.concurrencyLimit().map(c -> c.waitMs()).orElse(0L);
        final boolean acquired;
        try {
            acquired = (waitMs == 0) ? permits.tryAcquire() : permits.tryAcquire(waitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException(Status.CANCELLED, "Request was cancelled");
        }
        if (!acquired) {
            log.warn("Endpoint {} saturated, rejecting request", key);
            throw new DispatchException(Status.ENDPOINT_BUSY, "Endpoint is busy, retry later");
        }
    }

    /**
     * Builds {@code data = {method, route, headers, param, client}}. {@code param} is the query
     * string merged with the JSON object body; the body wins on conflicting keys.
     */
    Map<String, Object> seed(DispatchRequest request, RouteKey key) {
        final Map<String, Object> param = new LinkedHashMap<>(request.query());
        if (request.body().length > 0) {
            deepMerge(param, parseBody(request.body()));
        }

        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("method", request.method());
        data.put("route", key.route());
        data.put("headers", new LinkedHashMap<>(request.headers()));
        data.put("param", param);
        data.put("client", request.client());
        return data;
    }

    private Map<String, Object> parseBody(byte[] body) {
        final JsonNode node;
        try {
            node = json.readTree(body);
        } catch (IOException e) {
            throw new DispatchException(Status.MALFORMED_PAYLOAD, "Request body is not valid JSON");
        }
        if (node == null || node.isMissingNode()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new DispatchException(Status.MALFORMED_PAYLOAD, "Request body must be a JSON object");
        }
        @SuppressWarnings("unchecked")
        final Map<String, Object> map = json.convertValue(node, LinkedHashMap.class);
        return map;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> copyOf(Map<String, Object> source) {
        final Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, copyValue(v)));
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> m) {
            return copyOf((Map<String, Object>) m);
        }
        if (value instanceof List<?> l) {
            final List<Object> copy = new ArrayList<>(l.size());
            l.forEach(item -> copy.add(copyValue(item)));
            return copy;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    static void deepMerge(Map<String, Object> target, Map<String, Object> source) {
        for (Map.Entry<String, Object> e : source.entrySet()) {
            final Object existing = target.get(e.getKey());
            if (existing instanceof Map<?, ?> left && e.getValue() instanceof Map<?, ?> right) {
                final Map<String, Object> merged = new LinkedHashMap<>((Map<String, Object>) left);
                deepMerge(merged, (Map<String, Object>) right);
                target.put(e.getKey(), merged);
            } else {
                target.put(e.getKey(), e.getValue());
            }
        }
    }

    /**
     * If {@code data} has a {@code body} entry it is the response body, with optional
     * {@code headers} and {@code status}; otherwise the whole {@code data} map is returned.
     *
     * @throws IllegalArgumentException if {@code status} is present but not a valid HTTP status
     */
    DispatchResponse toResponse(Map<String, Object> data) {
        if (!data.containsKey("body")) {
            return DispatchResponse.ok(data);
        }

        final Map<String, String> headers = new LinkedHashMap<>();
        if (data.get("headers") instanceof Map<?, ?> raw) {
            for (Map.Entry<?, ?> h : raw.entrySet()) {
                if (h.getKey() == null || h.getValue() == null) continue;
                final String name = String.valueOf(h.getKey());
                if (RESERVED_RESPONSE_HEADERS.contains(name.toLowerCase(Locale.ROOT))) continue;
                headers.put(name, String.valueOf(h.getValue()));
            }
        }
        return new DispatchResponse(statusOf(data.get("status")), headers, data.get("body"));
    }

    static int statusOf(Object raw) {
        if (raw == null) return 200;
        final int status;
        try {
            // intValueExact rejects fractions and anything outside int range.
            status = new BigDecimal(String.valueOf(raw).trim()).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("status '" + raw + "' is not an integer", e);
        }
        if (status < 100 || status > 599) {
            throw new IllegalArgumentException("status " + status + " is outside 100..599");
        }
        return status;
    }

    /**
     * {@code /v<major>/<minor>/<route>}; anything else is empty.
     */
    static Optional<RouteKey> parsePath(String method, String path) {
        if (path == null) return Optional.empty();
        String p = path;
        while (p.startsWith("/")) p = p.substring(1);
        final String[] parts = p.split("/", 3);
        if (parts.length < 3 || parts[0].length() < 2 || parts[0].charAt(0) != 'v') {
            return Optional.empty();
        }
        final int major;
        final int minor;
        try {
            major = parseNonNegative(parts[0].substring(1));
            minor = parseNonNegative(parts[1]);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        final RouteKey key = new RouteKey(major, minor, parts[2], method);
        return key.route().isEmpty() ? Optional.empty() : Optional.of(key);
    }

    private static int parseNonNegative(String s) {
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (c < '0' || c > '9') throw new NumberFormatException(s);
        }
        return Integer.parseInt(s);
    }
}
