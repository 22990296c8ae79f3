/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.infra.metrics.impl.prometheus;

import com.herald.pushrules.infra.metrics.Counter;

/**
 * Bridges {@link Counter} to a Prometheus counter child bound to fixed label values.
 */
final class PrometheusCounterAdapter implements Counter {

    private final io.prometheus.client.Counter.Child counter;

    PrometheusCounterAdapter(io.prometheus.client.Counter counter, String[] labelValues) {
        if (labelValues == null) {
            throw new IllegalArgumentException("Label values cannot be null");
        }
        this.counter = counter.labels(labelValues);
    }

    @Override
    public void increment() {
        counter.inc();
    }

    /**
     * @throws IllegalArgumentException if amount is negative
     */
    @Override
    public void increment(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Counter increment amount cannot be negative: " + amount);
        }
        counter.inc(amount);
    }

    @Override
    public long count() {
        // Prometheus stores as double, but counters are always whole numbers
        return (long) counter.get();
    }

    @Override
    public String toString() {
        return String.format("PrometheusCounterAdapter{value=%d}", count());
    }
}
