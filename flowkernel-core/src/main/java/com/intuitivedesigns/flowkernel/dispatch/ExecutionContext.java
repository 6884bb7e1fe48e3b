/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.dispatch;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-request {@code data} and {@code state}. Created fresh for every request and never shared.
 */
public final class ExecutionContext {

    private final String requestId;
    private final ExecutionDeadline deadline;
    private Map<String, Object> data;
    private Map<String, Object> state;

    public ExecutionContext(String requestId, Map<String, Object> seed, ExecutionDeadline deadline) {
        this.requestId = Objects.requireNonNull(requestId, "requestId");
        this.deadline = (deadline != null) ? deadline : ExecutionDeadline.none();
        this.data = new LinkedHashMap<>(seed);
        this.state = new LinkedHashMap<>();
    }

    public String requestId() {
        return requestId;
    }

    public ExecutionDeadline deadline() {
        return deadline;
    }

    public Map<String, Object> data() {
        return data;
    }

    public Map<String, Object> state() {
        return state;
    }

    void advance(Map<String, Object> nextData, Map<String, Object> nextState) {
        this.data = nextData;
        this.state = nextState;
    }
}
