/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.dispatch;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a dispatch. {@code body} is serialized as JSON by the transport.
 */
public record DispatchResponse(int status, Map<String, String> headers, Object body) {

    public DispatchResponse {
        headers = (headers == null) ? Map.of() : Map.copyOf(headers);
    }

    public static DispatchResponse ok(Object body) {
        return new DispatchResponse(200, Map.of(), body);
    }

    /** Error body: {@code {"error": ..., "message": ..., "id": ...}}; {@code id} only when given. */
    public static DispatchResponse error(DispatchException.Status status, String message, String errorId,
                                         Map<String, String> headers) {
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", status.name());
        body.put("message", message);
        if (errorId != null) {
            body.put("id", errorId);
        }
        return new DispatchResponse(status.httpCode(), headers, body);
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
