/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.infra.metrics.impl.inmemory;

import com.herald.pushrules.infra.metrics.Counter;
import com.herald.pushrules.infra.metrics.Gauge;
import com.herald.pushrules.infra.metrics.MetricsRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory metrics registry for testing.
 *
 * <p>Provides access to recorded values for assertions:
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
 * RoomRulesCacheRegistry registry = new RoomRulesCacheRegistry(config, store, users, metrics);
 * ...
 * assertThat(metrics.getCounterValue("room_rules_stale_discards")).isEqualTo(1L);
 * }</pre>
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryGauge> gauges = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(name, InMemoryCounter::new);
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(name, InMemoryGauge::new);
    }

    // Test helper methods

    public long getCounterValue(String name) {
        Counter counter = counters.get(name);
        return counter != null ? counter.count() : 0L;
    }

    public double getGaugeValue(String name) {
        Gauge gauge = gauges.get(name);
        return gauge != null ? gauge.value() : 0.0;
    }

    public void reset() {
        counters.clear();
        gauges.clear();
    }
}
