/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.infra.metrics.internal;

import com.herald.pushrules.infra.metrics.MetricsRegistry;
import com.herald.pushrules.infra.metrics.api.MetricsRegistryProvider;

import java.util.Optional;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/**
 * Process-wide registry behind {@link MetricsRegistry#getInstance()}.
 *
 * <p>
 * Providers are discovered with {@link ServiceLoader}. The system property
 * {@value #PROVIDER_PROPERTY} pins one by {@link MetricsRegistryProvider#name()};
 * otherwise the highest priority wins. With no provider, metrics are dropped.
 */
public final class MetricsRegistryHolder {

    public static final String PROVIDER_PROPERTY = "herald.metrics.provider";

    private static final Logger logger = Logger.getLogger(MetricsRegistryHolder.class.getName());

    public static final MetricsRegistry INSTANCE = load();

    private MetricsRegistryHolder() {
        throw new AssertionError("No instances");
    }

    private static MetricsRegistry load() {
        String pinned = System.getProperty(PROVIDER_PROPERTY);
        Optional<MetricsRegistryProvider> provider =
                select(ServiceLoader.load(MetricsRegistryProvider.class), pinned);
        if (provider.isEmpty()) {
            logger.info("No metrics provider found, push rule metrics are disabled");
            return NoOpMetricsRegistry.INSTANCE;
        }
        MetricsRegistryProvider chosen = provider.get();
        logger.info("Push rule metrics go to " + chosen.name() + " (priority " + chosen.priority()
                + (pinned != null ? ", pinned by " + PROVIDER_PROPERTY : "") + ")");
        return chosen.create();
    }

    /**
     * @param pinnedName provider name to prefer, or {@code null}
     * @return the provider named {@code pinnedName} if present, else the one
     * with the highest priority
     */
    static Optional<MetricsRegistryProvider> select(Iterable<MetricsRegistryProvider> providers, String pinnedName) {
        MetricsRegistryProvider best = null;
        for (MetricsRegistryProvider candidate : providers) {
            if (pinnedName != null && pinnedName.equals(candidate.name())) {
                return Optional.of(candidate);
            }
            if (best == null || candidate.priority() > best.priority()) {
                best = candidate;
            }
        }
        if (pinnedName != null && best != null) {
            logger.warning("Metrics provider " + pinnedName + " not found, falling back to " + best.name());
        }
        return Optional.ofNullable(best);
    }
}
