/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.spi;

/**
 * Domain failure raised by a node operator. The message is logged, never returned to HTTP callers.
 */
public class NodeExecutionException extends RuntimeException {

    public NodeExecutionException(String message) {
        super(message);
    }

    public NodeExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
