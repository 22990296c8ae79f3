/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.infra.metrics.impl.prometheus;

import com.herald.pushrules.infra.metrics.Counter;
import com.herald.pushrules.infra.metrics.Gauge;
import com.herald.pushrules.infra.metrics.MetricsRegistry;
import io.prometheus.client.CollectorRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prometheus implementation of MetricsRegistry.
 * Thread-safe.
 */
public final class PrometheusMetricsRegistry implements MetricsRegistry {

    private final CollectorRegistry registry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Gauge> gauges = new ConcurrentHashMap<>();

    public PrometheusMetricsRegistry() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusMetricsRegistry(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(name, n -> {
            io.prometheus.client.Counter promCounter =
                    io.prometheus.client.Counter.build()
                            .name(sanitizeName(n))
                            .help("Herald push rules counter " + n)
                            .labelNames(extractLabelNames(tags))
                            .register(registry);

            return new PrometheusCounterAdapter(promCounter, extractLabelValues(tags));
        });
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(name, n -> {
            io.prometheus.client.Gauge promGauge =
                    io.prometheus.client.Gauge.build()
                            .name(sanitizeName(n))
                            .help("Herald push rules gauge " + n)
                            .labelNames(extractLabelNames(tags))
                            .register(registry);

            return new PrometheusGaugeAdapter(promGauge, extractLabelValues(tags));
        });
    }

    static String sanitizeName(String name) {
        return name.toLowerCase()
                .replaceAll("[^a-z0-9_:]", "_")
                .replaceAll("_{2,}", "_");
    }

    private static String[] extractLabelNames(String[] tags) {
        String[] labels = new String[tags.length / 2];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = tags[i * 2];
        }
        return labels;
    }

    private static String[] extractLabelValues(String[] tags) {
        String[] values = new String[tags.length / 2];
        for (int i = 0; i < values.length; i++) {
            values[i] = tags[i * 2 + 1];
        }
        return values;
    }
}
