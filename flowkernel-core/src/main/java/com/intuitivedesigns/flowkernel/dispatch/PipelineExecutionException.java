/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.dispatch;

/**
 * A node failed. Carries the node identity for the error log; never shown to callers.
 */
public class PipelineExecutionException extends RuntimeException {

    private final String pipeline;
    private final String nodeName;
    private final String nodeType;

    public PipelineExecutionException(String pipeline, String nodeName, String nodeType, Throwable cause) {
        super("Node '" + nodeName + "' (" + nodeType + ") of pipeline '" + pipeline + "' failed: "
                + (cause == null ? "no result" : cause.getMessage()), cause);
        this.pipeline = pipeline;
        this.nodeName = nodeName;
        this.nodeType = nodeType;
    }

    public String pipeline() {
        return pipeline;
    }

    public String nodeName() {
        return nodeName;
    }

    public String nodeType() {
        return nodeType;
    }
}
