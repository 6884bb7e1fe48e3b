/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.dispatch;

import java.util.concurrent.TimeUnit;

/**
 * Monotonic wall-clock budget for one request.
 */
public final class ExecutionDeadline {

    private static final ExecutionDeadline NONE = new ExecutionDeadline(Long.MAX_VALUE, false);

    private final long deadlineNanos;
    private final boolean bounded;

    private ExecutionDeadline(long deadlineNanos, boolean bounded) {
        this.deadlineNanos = deadlineNanos;
        this.bounded = bounded;
    }

    public static ExecutionDeadline none() {
        return NONE;
    }

    /** A timeout of 0 or less means unbounded. */
    public static ExecutionDeadline afterMillis(long timeoutMs) {
        if (timeoutMs <= 0) return NONE;
        return new ExecutionDeadline(System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs), true);
    }

    public boolean expired() {
        return bounded && System.nanoTime() - deadlineNanos >= 0;
    }

    public boolean bounded() {
        return bounded;
    }
}
