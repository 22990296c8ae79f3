/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.infra.metrics;

import com.herald.pushrules.infra.metrics.internal.MetricsRegistryHolder;
import com.herald.pushrules.infra.metrics.internal.NoOpMetricsRegistry;

/**
 * Framework-agnostic metrics registry.
 *
 * <p>Components receive a registry through their constructor; the process-wide
 * default is discovered via {@link java.util.ServiceLoader}.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * MetricsRegistry metrics = MetricsRegistry.getInstance();
 * Counter discards = metrics.counter("room_rules_stale_discards");
 * discards.increment();
 * }</pre>
 */
public interface MetricsRegistry {

    /**
     * Creates or retrieves a counter metric.
     *
     * @param name metric name (lowercase, underscores only)
     * @param tags optional key-value pairs for labels
     * @return thread-safe counter instance
     */
    Counter counter(String name, String... tags);

    /**
     * Creates or retrieves a gauge metric.
     *
     * @param name metric name
     * @param tags optional key-value pairs
     * @return thread-safe gauge instance
     */
    Gauge gauge(String name, String... tags);

    /**
     * Gets the process-wide registry.
     *
     * <p>Implementation is discovered via ServiceLoader.
     * Falls back to no-op if no provider found.
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }

    static MetricsRegistry noop() {
        return NoOpMetricsRegistry.INSTANCE;
    }
}
