/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.dispatch;

/**
 * The walk was abandoned between nodes.
 */
public class PipelineCancelledException extends RuntimeException {

    public enum Reason { DEADLINE, INTERRUPTED }

    private final Reason reason;
    private final String nextNode;

    public PipelineCancelledException(Reason reason, String pipeline, String nextNode) {
        super("Pipeline '" + pipeline + "' abandoned before node '" + nextNode + "': " + reason);
        this.reason = reason;
        this.nextNode = nextNode;
    }

    public Reason reason() {
        return reason;
    }

    public String nextNode() {
        return nextNode;
    }
}
