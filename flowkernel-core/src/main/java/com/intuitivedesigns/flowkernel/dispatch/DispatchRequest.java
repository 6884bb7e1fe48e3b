/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.dispatch;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Transport-neutral view of an inbound request.
 *
 * @param path    request path without the query string, e.g. {@code /v1/0/hello}
 * @param headers header names are lower-cased; repeated headers are joined with {@code ", "}
 * @param query   decoded query parameters; a repeated name maps to a list of values
 * @param body    raw body bytes, never {@code null}
 * @param client  remote address as {@code host:port}, or {@code null} if unknown
 */
public record DispatchRequest(String method,
                              String path,
                              Map<String, String> headers,
                              Map<String, Object> query,
                              byte[] body,
                              String client) {

    private static final byte[] EMPTY = new byte[0];

    public DispatchRequest {
        method = Objects.requireNonNull(method, "method").toUpperCase(Locale.ROOT);
        Objects.requireNonNull(path, "path");
        final Map<String, String> lowered = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((k, v) -> lowered.put(k.toLowerCase(Locale.ROOT), v));
        }
        headers = Collections.unmodifiableMap(lowered);
        query = (query == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(query));
        body = (body == null) ? EMPTY : body;
    }

    public static DispatchRequest of(String method, String path) {
        return new DispatchRequest(method, path, Map.of(), Map.of(), EMPTY, null);
    }

    public static DispatchRequest of(String method, String path, String jsonBody) {
        return new DispatchRequest(method, path, Map.of("content-type", "application/json"), Map.of(),
                jsonBody == null ? EMPTY : jsonBody.getBytes(StandardCharsets.UTF_8), null);
    }
}
