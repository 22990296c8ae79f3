/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.infra.metrics.impl.prometheus;

import com.herald.pushrules.infra.metrics.Gauge;

/**
 * Bridges {@link Gauge} to a Prometheus gauge child. Last write wins.
 */
final class PrometheusGaugeAdapter implements Gauge {

    private final io.prometheus.client.Gauge.Child gauge;

    PrometheusGaugeAdapter(io.prometheus.client.Gauge gauge, String[] labelValues) {
        if (labelValues == null) {
            throw new IllegalArgumentException("Label values cannot be null");
        }
        this.gauge = gauge.labels(labelValues);
    }

    @Override
    public void set(double value) {
        gauge.set(value);
    }

    @Override
    public double value() {
        return gauge.get();
    }

    @Override
    public String toString() {
        return String.format("PrometheusGaugeAdapter{value=%.2f}", value());
    }
}
