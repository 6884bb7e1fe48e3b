/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.model;

/**
 * Bound on in-flight pipeline walks for one endpoint.
 *
 * @param limit  maximum concurrent walks, at least 1
 * @param waitMs how long a request may wait for a slot before being turned away
 */
public record ConcurrencyLimit(int limit, long waitMs) {

    public ConcurrencyLimit {
        if (limit <= 0) throw new IllegalArgumentException("concurrency.limit must be > 0");
        if (waitMs < 0) throw new IllegalArgumentException("concurrency.wait-ms must be >= 0");
    }
}
