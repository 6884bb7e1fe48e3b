/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsRuntime} backed by a Micrometer {@link MeterRegistry}.
 *
 * <p>{@link #gauge} is push-style: the last value is kept as raw double bits and Micrometer
 * polls it.</p>
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final MeterRegistry registry;
    private final String type;
    private final AutoCloseable onClose;

    private final Map<String, AtomicLong> gaugeBits = new ConcurrentHashMap<>();

    public MicrometerMetricsRuntime(MeterRegistry registry, String type, AutoCloseable onClose) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.type = Objects.requireNonNull(type, "type");
        this.onClose = onClose;
    }

    /** In-memory runtime, handy in tests and local runs. */
    public static MicrometerMetricsRuntime simple() {
        return new MicrometerMetricsRuntime(new SimpleMeterRegistry(), "SIMPLE", null);
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public void counter(String name) {
        registry.counter(name).increment();
    }

    @Override
    public void taggedCounter(String name, String... tagKeyValues) {
        registry.counter(name, Tags.of(tagKeyValues)).increment();
    }

    @Override
    public void timer(String name, long durationMillis) {
        registry.timer(name).record(durationMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void gauge(String name, double value) {
        gaugeBits.computeIfAbsent(name, key -> {
            final AtomicLong bits = new AtomicLong();
            Gauge.builder(key, bits, b -> Double.longBitsToDouble(b.get())).register(registry);
            return bits;
        }).set(Double.doubleToLongBits(value));
    }

    @Override
    public void close() {
        if (onClose != null) {
            try {
                onClose.close();
            } catch (Exception e) {
                log.warn("Error closing {} metrics resources", type, e);
            }
        }
        registry.close();
        log.info("Metrics runtime closed ({})", type);
    }
}
