/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.nodes;

import com.intuitivedesigns.flowkernel.config.NodeConfig;
import com.intuitivedesigns.flowkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.flowkernel.spi.NodeExecutionException;
import com.intuitivedesigns.flowkernel.spi.NodeOperator;
import com.intuitivedesigns.flowkernel.spi.NodePlugin;
import com.intuitivedesigns.flowkernel.spi.NodeResult;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ParseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code transformer 1.0}: assigns keys of {@code data} and {@code state} from expressions.
 *
 * <pre>
 * config:
 *   data:  { A: "data.A + 1", greeting: "'hello ' + data.param.name" }
 *   state: { seen: "true" }
 *   drop:  [ headers ]
 * </pre>
 *
 * <p>Assignments run in declaration order ({@code data} first, then {@code state}) and each
 * one sees the writes before it. String values are expressions; any other YAML value is
 * assigned as a constant. {@code drop} removes data keys last.</p>
 */
public final class TransformerNodePlugin implements NodePlugin {

    public static final String TYPE = "transformer";
    public static final String VERSION = "1.0";

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public String version() {
        return VERSION;
    }

    @Override
    public NodeOperator create(NodeConfig config, MetricsRuntime metrics) {
        final List<Assignment> dataAssignments = assignments(config, "data");
        final List<Assignment> stateAssignments = assignments(config, "state");
        final List<String> drop = new ArrayList<>();
        for (Object o : config.getList("drop")) {
            drop.add(String.valueOf(o));
        }
        if (dataAssignments.isEmpty() && stateAssignments.isEmpty() && drop.isEmpty()) {
            throw new IllegalArgumentException("transformer needs at least one of 'data', 'state' or 'drop'");
        }
        return new Operator(dataAssignments, stateAssignments, List.copyOf(drop), config.asMap());
    }

    private static List<Assignment> assignments(NodeConfig config, String section) {
        if (config.has(section) && !(config.get(section) instanceof Map<?, ?>)) {
            throw new IllegalArgumentException("'" + section + "' must be a mapping of key to expression");
        }
        final List<Assignment> out = new ArrayList<>();
        for (Map.Entry<String, Object> e : config.getMap(section).entrySet()) {
            final Object raw = e.getValue();
            if (raw instanceof String text) {
                try {
                    out.add(new Assignment(e.getKey(), text, ExpressionSandbox.parse(text), null));
                } catch (ParseException pe) {
                    throw new IllegalArgumentException(section + "." + e.getKey() + ": cannot parse '" + text + "': " + pe.getMessage(), pe);
                }
            } else {
                out.add(new Assignment(e.getKey(), String.valueOf(raw), null, raw));
            }
        }
        return List.copyOf(out);
    }

    private record Assignment(String key, String source, Expression expression, Object constant) {

        Object value(Map<String, Object> data, Map<String, Object> state, Map<String, Object> config) {
            return expression == null ? constant : ExpressionSandbox.evaluate(expression, data, state, config);
        }
    }

    private static final class Operator implements NodeOperator {
        private final List<Assignment> dataAssignments;
        private final List<Assignment> stateAssignments;
        private final List<String> drop;
        private final Map<String, Object> config;

        Operator(List<Assignment> dataAssignments, List<Assignment> stateAssignments,
                 List<String> drop, Map<String, Object> config) {
            this.dataAssignments = dataAssignments;
            this.stateAssignments = stateAssignments;
            this.drop = drop;
            this.config = config;
        }

        @Override
        public NodeResult apply(Map<String, Object> data, Map<String, Object> state) {
            final Map<String, Object> nextData = new LinkedHashMap<>(data);
            final Map<String, Object> nextState = new LinkedHashMap<>(state);

            for (Assignment a : dataAssignments) {
                nextData.put(a.key(), eval(a, "data", nextData, nextState));
            }
            for (Assignment a : stateAssignments) {
                nextState.put(a.key(), eval(a, "state", nextData, nextState));
            }
            for (String key : drop) {
                nextData.remove(key);
            }
            return NodeResult.of(nextData, nextState);
        }

        private Object eval(Assignment a, String section, Map<String, Object> data, Map<String, Object> state) {
            try {
                return a.value(data, state, config);
            } catch (EvaluationException e) {
                throw new NodeExecutionException(section + "." + a.key() + " = '" + a.source() + "' failed: " + e.getMessage(), e);
            }
        }
    }
}
