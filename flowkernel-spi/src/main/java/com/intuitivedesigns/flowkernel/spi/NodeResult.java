/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.spi;

import java.util.Map;
import java.util.Objects;

/**
 * The {@code (data', state')} pair returned by a {@link NodeOperator}.
 *
 * @param data  payload for the next node
 * @param state accumulator for the next node
 */
public record NodeResult(Map<String, Object> data, Map<String, Object> state) {

    public NodeResult {
        Objects.requireNonNull(data, "NodeResult data cannot be null");
        Objects.requireNonNull(state, "NodeResult state cannot be null");
    }

    public static NodeResult of(Map<String, Object> data, Map<String, Object> state) {
        return new NodeResult(data, state);
    }
}
