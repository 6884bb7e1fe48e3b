/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.dispatch;

import com.intuitivedesigns.flowkernel.compile.CompiledNode;
import com.intuitivedesigns.flowkernel.compile.CompiledPipeline;
import com.intuitivedesigns.flowkernel.dispatch.PipelineCancelledException.Reason;
import com.intuitivedesigns.flowkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.flowkernel.spi.NodeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Walks a compiled pipeline sequentially in topological order.
 *
 * <p>Deadline and interrupt are checked between nodes only; a running operator is never
 * cut short by the executor. The first failing node ends the walk. No retries.</p>
 */
public final class PipelineExecutor {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

    private final MetricsRuntime metrics;

    public PipelineExecutor(MetricsRuntime metrics) {
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.noop();
    }

    /**
     * @throws PipelineExecutionException  if a node throws or returns no result
     * @throws PipelineCancelledException if the deadline passed or the thread was interrupted
     */
    public ExecutionContext execute(CompiledPipeline pipeline, ExecutionContext ctx) {
        Objects.requireNonNull(pipeline, "pipeline");
        Objects.requireNonNull(ctx, "ctx");

        for (CompiledNode node : pipeline.nodes()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new PipelineCancelledException(Reason.INTERRUPTED, pipeline.name(), node.name());
            }
            if (ctx.deadline().expired()) {
                throw new PipelineCancelledException(Reason.DEADLINE, pipeline.name(), node.name());
            }

            final NodeResult result;
            try {
                result = node.operator().apply(ctx.data(), ctx.state());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PipelineCancelledException(Reason.INTERRUPTED, pipeline.name(), node.name());
            } catch (Exception e) {
                metrics.taggedCounter("node.failures", "pipeline", pipeline.name(), "type", node.typeLabel());
                throw new PipelineExecutionException(pipeline.name(), node.name(), node.typeLabel(), e);
            }

            if (result == null) {
                metrics.taggedCounter("node.failures", "pipeline", pipeline.name(), "type", node.typeLabel());
                throw new PipelineExecutionException(pipeline.name(), node.name(), node.typeLabel(), null);
            }
            ctx.advance(result.data(), result.state());

            if (log.isTraceEnabled()) {
                log.trace("[{}] {} node '{}' done", ctx.requestId(), pipeline.name(), node.name());
            }
        }
        return ctx;
    }
}
