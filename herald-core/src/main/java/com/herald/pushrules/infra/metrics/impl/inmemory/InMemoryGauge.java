/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.infra.metrics.impl.inmemory;

import com.herald.pushrules.infra.metrics.Gauge;

import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link Gauge} for testing.
 */
final class InMemoryGauge implements Gauge {

    private final String name;
    private final AtomicReference<Double> value = new AtomicReference<>(0.0);

    InMemoryGauge(String name) {
        this.name = name;
    }

    @Override
    public void set(double newValue) {
        value.set(newValue);
    }

    @Override
    public double value() {
        return value.get();
    }

    @Override
    public String toString() {
        return String.format("InMemoryGauge{name='%s', value=%.2f}", name, value());
    }
}
