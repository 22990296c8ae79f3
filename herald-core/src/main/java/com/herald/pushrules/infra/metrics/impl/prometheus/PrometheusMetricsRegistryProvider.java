/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.infra.metrics.impl.prometheus;

import com.herald.pushrules.infra.metrics.MetricsRegistry;
import com.herald.pushrules.infra.metrics.api.MetricsRegistryProvider;

/**
 * Prometheus-backed metrics provider, registered in {@code META-INF/services}.
 */
public final class PrometheusMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new PrometheusMetricsRegistry();
    }

    @Override
    public int priority() {
        return 100;  // Prefer Prometheus in production
    }

    @Override
    public String name() {
        return "Prometheus";
    }
}
