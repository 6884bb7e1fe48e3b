/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.dispatch;

import java.util.Map;
import java.util.Objects;

/**
 * Request-time rejection. The message is safe to return to the caller.
 */
public class DispatchException extends RuntimeException {

    public enum Status {
        NO_SUCH_ENDPOINT(404),
        METHOD_NOT_ALLOWED(405),
        PAYLOAD_TOO_SMALL(400),
        PAYLOAD_TOO_LARGE(413),
        MALFORMED_PAYLOAD(400),
        ENDPOINT_BUSY(503),
        CANCELLED(503),
        PIPELINE_FAILED(500),
        REQUEST_TIMEOUT(504);

        private final int httpCode;

        Status(int httpCode) {
            this.httpCode = httpCode;
        }

        public int httpCode() {
            return httpCode;
        }
    }

    private final Status status;
    private final Map<String, String> headers;

    public DispatchException(Status status, String message) {
        this(status, message, Map.of());
    }

    public DispatchException(Status status, String message, Map<String, String> headers) {
        super(message);
        this.status = Objects.requireNonNull(status, "status");
        this.headers = Map.copyOf(headers);
    }

    public Status status() {
        return status;
    }

    /** Extra response headers, e.g. {@code Allow} for {@link Status#METHOD_NOT_ALLOWED}. */
    public Map<String, String> headers() {
        return headers;
    }
}
