/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.nodes;

import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.PropertyAccessor;
import org.springframework.expression.TypeLocator;
import org.springframework.expression.TypedValue;
import org.springframework.expression.spel.SpelEvaluationException;
import org.springframework.expression.spel.SpelMessage;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.expression.spel.support.StandardTypeLocator;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.Method;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Constrained SpEL for node expressions.
 *
 * <p>Roots: {@code data}, {@code state}, {@code config} (also as {@code #data}, {@code #state},
 * {@code #config}). Maps are read-only through property access. Type references, constructors,
 * bean references and method calls are rejected.</p>
 *
 * <p>Functions: {@code #upper(s)}, {@code #lower(s)}, {@code #trim(s)}, {@code #size(x)},
 * {@code #uuid()}, {@code #nowIso()}.</p>
 */
final class ExpressionSandbox {

    private static final ExpressionParser PARSER = new SpelExpressionParser();
    private static final TypeLocator BLOCKING_TYPE_LOCATOR = new BlockingTypeLocator();

    private static final Map<String, Method> FUNCTIONS = functions();

    private ExpressionSandbox() {}

    /**
     * @throws org.springframework.expression.ParseException if the expression does not parse
     */
    static Expression parse(String expression) {
        return PARSER.parseExpression(expression);
    }

    static Object evaluate(Expression expression,
                           Map<String, Object> data,
                           Map<String, Object> state,
                           Map<String, Object> config) {
        final Map<String, Object> root = new LinkedHashMap<>(4);
        root.put("data", data);
        root.put("state", state);
        root.put("config", config);

        final StandardEvaluationContext context = new StandardEvaluationContext(root);
        context.setTypeLocator(BLOCKING_TYPE_LOCATOR);
        context.setPropertyAccessors(List.of(new MapEntryAccessor()));
        context.setMethodResolvers(List.of());
        context.setConstructorResolvers(List.of());
        context.setBeanResolver(null);
        root.forEach(context::setVariable);
        FUNCTIONS.forEach(context::registerFunction);

        return expression.getValue(context);
    }

    private static Map<String, Method> functions() {
        final Map<String, Method> m = new LinkedHashMap<>();
        m.put("upper", find("upper", Object.class));
        m.put("lower", find("lower", Object.class));
        m.put("trim", find("trim", Object.class));
        m.put("size", find("size", Object.class));
        m.put("uuid", find("uuid"));
        m.put("nowIso", find("nowIso"));
        return Map.copyOf(m);
    }

    private static Method find(String name, Class<?>... params) {
        return Objects.requireNonNull(ReflectionUtils.findMethod(Functions.class, name, params), name + " method missing");
    }

    private static final class BlockingTypeLocator extends StandardTypeLocator {
        @Override
        public Class<?> findType(String typeName) {
            throw new SpelEvaluationException(SpelMessage.TYPE_NOT_FOUND, typeName);
        }
    }

    private static final class MapEntryAccessor implements PropertyAccessor {
        @Override
        public Class<?>[] getSpecificTargetClasses() {
            return new Class<?>[]{Map.class};
        }

        @Override
        public boolean canRead(EvaluationContext context, Object target, String name) {
            return target instanceof Map<?, ?>;
        }

        @Override
        public TypedValue read(EvaluationContext context, Object target, String name) {
            return new TypedValue(((Map<?, ?>) target).get(name));
        }

        @Override
        public boolean canWrite(EvaluationContext context, Object target, String name) {
            return false;
        }

        @Override
        public void write(EvaluationContext context, Object target, String name, Object newValue) {
            throw new UnsupportedOperationException("read-only map accessor");
        }
    }

    static final class Functions {
        private Functions() {}

        public static String upper(Object value) {
            return value == null ? null : String.valueOf(value).toUpperCase(Locale.ROOT);
        }

        public static String lower(Object value) {
            return value == null ? null : String.valueOf(value).toLowerCase(Locale.ROOT);
        }

        public static String trim(Object value) {
            return value == null ? null : String.valueOf(value).trim();
        }

        public static int size(Object value) {
            if (value == null) return 0;
            if (value instanceof Map<?, ?> map) return map.size();
            if (value instanceof Collection<?> c) return c.size();
            return String.valueOf(value).length();
        }

        public static String uuid() {
            return UUID.randomUUID().toString();
        }

        public static String nowIso() {
            return DateTimeFormatter.ISO_INSTANT.format(Instant.now());
        }
    }
}
