/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.infra.metrics.api;

import com.herald.pushrules.infra.metrics.MetricsRegistry;

/**
 * Service Provider Interface for {@link MetricsRegistry} implementations.
 *
 * <p>Implementations must:
 * <ul>
 *   <li>Have a public no-arg constructor
 *   <li>Be thread-safe
 *   <li>Register themselves in {@code META-INF/services}
 * </ul>
 */
public interface MetricsRegistryProvider {

    MetricsRegistry create();

    /**
     * Higher values are preferred when multiple providers exist.
     */
    default int priority() {
        return 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
