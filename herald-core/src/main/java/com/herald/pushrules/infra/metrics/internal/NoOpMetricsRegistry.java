/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.infra.metrics.internal;

import com.herald.pushrules.infra.metrics.Counter;
import com.herald.pushrules.infra.metrics.Gauge;
import com.herald.pushrules.infra.metrics.MetricsRegistry;

/**
 * Registry used when no provider is on the classpath. Every name maps to the
 * same counter and gauge, both of which discard what they are given.
 */
public final class NoOpMetricsRegistry implements MetricsRegistry {

    public static final NoOpMetricsRegistry INSTANCE = new NoOpMetricsRegistry();

    private static final Counter DISCARDING_COUNTER = new Counter() {
        @Override
        public void increment(long amount) {
        }

        @Override
        public long count() {
            return 0L;
        }
    };

    private static final Gauge DISCARDING_GAUGE = new Gauge() {
        @Override
        public void set(double value) {
        }

        @Override
        public double value() {
            return 0.0;
        }
    };

    private NoOpMetricsRegistry() {
    }

    @Override
    public Counter counter(String name, String... tags) {
        return DISCARDING_COUNTER;
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return DISCARDING_GAUGE;
    }
}
