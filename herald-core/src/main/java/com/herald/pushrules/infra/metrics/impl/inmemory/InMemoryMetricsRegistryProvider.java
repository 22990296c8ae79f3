/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.infra.metrics.impl.inmemory;

import com.herald.pushrules.infra.metrics.MetricsRegistry;
import com.herald.pushrules.infra.metrics.api.MetricsRegistryProvider;

/**
 * In-memory metrics provider for testing.
 *
 * <p>To enable in tests, create:
 * <pre>
 * src/test/resources/META-INF/services/com.herald.pushrules.infra.metrics.api.MetricsRegistryProvider
 *
 * Contents:
 * com.herald.pushrules.infra.metrics.impl.inmemory.InMemoryMetricsRegistryProvider
 * </pre>
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;  // Highest priority in test environment
    }

    @Override
    public String name() {
        return "InMemory (Test)";
    }
}
