/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.dispatch;

import com.intuitivedesigns.flowkernel.compile.CompiledPipeline;
import com.intuitivedesigns.flowkernel.compile.PipelineCompiler;
import com.intuitivedesigns.flowkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.flowkernel.metrics.MicrometerMetricsRuntime;
import com.intuitivedesigns.flowkernel.registry.NodeTypeRegistry;
import com.intuitivedesigns.flowkernel.spi.NodeResult;
import com.intuitivedesigns.flowkernel.testing.CountingNodeExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.intuitivedesigns.flowkernel.testing.Pipelines.node;
import static com.intuitivedesigns.flowkernel.testing.Pipelines.pipeline;
import static com.intuitivedesigns.flowkernel.testing.Pipelines.registry;
import static org.junit.jupiter.api.Assertions.*;

class PipelineExecutorTest {

    private final PipelineCompiler compiler = new PipelineCompiler(registry(), MetricsRuntime.noop());
    private final PipelineExecutor executor = new PipelineExecutor(MetricsRuntime.noop());

    @BeforeEach
    void reset() {
        CountingNodeExtension.INVOCATIONS.set(0);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private static ExecutionContext context(Map<String, Object> seed) {
        return new ExecutionContext("req-1", seed, ExecutionDeadline.none());
    }

    @Test
    void testEachNodeSeesPredecessorEffects() {
        CompiledPipeline p = compiler.compile(pipeline("acc", List.of(
                        node("I", "transformer", Map.of("state", Map.of("trail", "'I'"))),
                        node("M", "transformer", Map.of("state", Map.of("trail", "state.trail + 'M'"))),
                        node("O", "transformer", Map.of("data", Map.of("trail", "state.trail + 'O'")))),
                "I -> M -> O"));

        ExecutionContext ctx = executor.execute(p, context(Map.of()));

        assertEquals("IMO", ctx.data().get("trail"));
        assertEquals("IM", ctx.state().get("trail"));
    }

    @Test
    void testSeedIsCopiedNotAliased() {
        CompiledPipeline p = compiler.compile(pipeline("p", List.of(
                node("T", "transformer", Map.of("data", Map.of("x", "2"))))));
        Map<String, Object> seed = Map.of("x", 1);

        ExecutionContext ctx = executor.execute(p, context(seed));

        assertEquals(2, ctx.data().get("x"));
        assertEquals(1, seed.get("x"));
    }

    @Test
    void testFailureNamesTheNode() {
        MicrometerMetricsRuntime metrics = MicrometerMetricsRuntime.simple();
        PipelineExecutor counted = new PipelineExecutor(metrics);
        CompiledPipeline p = compiler.compile(pipeline("f", List.of(node("Bad", "boom"), node("Next", "count")), "Bad -> Next"));

        PipelineExecutionException e = assertThrows(PipelineExecutionException.class,
                () -> counted.execute(p, context(Map.of())));

        assertEquals("Bad", e.nodeName());
        assertEquals("boom@1.0", e.nodeType());
        assertEquals("f", e.pipeline());
        assertEquals(0, CountingNodeExtension.INVOCATIONS.get());
        assertEquals(1.0, metrics.registry().get("node.failures").counter().count());
    }

    @Test
    void testNullResultIsFailure() {
        NodeTypeRegistry registry = new NodeTypeRegistry();
        registry.register(CountingNodeExtension.plugin("null", (config, metrics) -> (data, state) -> null));
        registry.freeze();
        CompiledPipeline p = new PipelineCompiler(registry, MetricsRuntime.noop())
                .compile(pipeline("n", List.of(node("N", "null"))));

        assertThrows(PipelineExecutionException.class, () -> executor.execute(p, context(Map.of())));
    }

    @Test
    void testInterruptedThreadStopsBeforeNextNode() {
        CompiledPipeline p = compiler.compile(pipeline("i", List.of(node("C", "count"))));

        Thread.currentThread().interrupt();
        PipelineCancelledException e = assertThrows(PipelineCancelledException.class,
                () -> executor.execute(p, context(Map.of())));

        assertEquals(PipelineCancelledException.Reason.INTERRUPTED, e.reason());
        assertEquals("C", e.nextNode());
        assertEquals(0, CountingNodeExtension.INVOCATIONS.get());
    }

    @Test
    void testInterruptedSleepReportsCancellation() {
        NodeTypeRegistry registry = new NodeTypeRegistry();
        registry.register(CountingNodeExtension.plugin("interrupting", (config, metrics) -> (data, state) -> {
            throw new InterruptedException("stop");
        }));
        registry.register(CountingNodeExtension.plugin("ok", (config, metrics) -> NodeResult::of));
        registry.freeze();
        CompiledPipeline p = new PipelineCompiler(registry, MetricsRuntime.noop())
                .compile(pipeline("s", List.of(node("S", "interrupting"), node("O", "ok")), "S -> O"));

        PipelineCancelledException e = assertThrows(PipelineCancelledException.class,
                () -> executor.execute(p, context(Map.of())));

        assertEquals(PipelineCancelledException.Reason.INTERRUPTED, e.reason());
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void testExpiredDeadlineStopsWalk() throws InterruptedException {
        CompiledPipeline p = compiler.compile(pipeline("d", List.of(node("C", "count"))));
        ExecutionDeadline deadline = ExecutionDeadline.afterMillis(1);
        Thread.sleep(5);

        PipelineCancelledException e = assertThrows(PipelineCancelledException.class,
                () -> executor.execute(p, new ExecutionContext("req", Map.of(), deadline)));

        assertEquals(PipelineCancelledException.Reason.DEADLINE, e.reason());
        assertFalse(ExecutionDeadline.none().expired());
        assertFalse(ExecutionDeadline.afterMillis(0).bounded());
    }
}
