package com.herald.pushrules.infra.metrics.internal;

import com.herald.pushrules.infra.metrics.MetricsRegistry;
import com.herald.pushrules.infra.metrics.api.MetricsRegistryProvider;
import com.herald.pushrules.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryHolderTest {

    @Test
    @DisplayName("Should pick the highest priority provider on the classpath")
    void picksHighestPriorityProvider() {
        // test resources register the in-memory provider above the Prometheus one
        assertThat(MetricsRegistry.getInstance()).isInstanceOf(InMemoryMetricsRegistry.class);
        assertThat(MetricsRegistry.getInstance()).isSameAs(MetricsRegistryHolder.INSTANCE);
    }

    @Test
    @DisplayName("Should hand out a no-op registry that records nothing")
    void noopRegistry() {
        MetricsRegistry noop = MetricsRegistry.noop();

        noop.counter("anything").increment(10);
        noop.gauge("anything").set(5);

        assertThat(noop.counter("anything").count()).isZero();
        assertThat(noop.gauge("anything").value()).isZero();
    }

    @Test
    @DisplayName("Should prefer a pinned provider over a higher priority one")
    void pinnedProviderWins() {
        MetricsRegistryProvider low = provider("low", 10);
        MetricsRegistryProvider high = provider("high", 500);

        assertThat(MetricsRegistryHolder.select(List.of(high, low), null)).containsSame(high);
        assertThat(MetricsRegistryHolder.select(List.of(high, low), "low")).containsSame(low);
        assertThat(MetricsRegistryHolder.select(List.of(high, low), "missing")).containsSame(high);
        assertThat(MetricsRegistryHolder.select(List.of(), null)).isEmpty();
    }

    private static MetricsRegistryProvider provider(String name, int priority) {
        return new MetricsRegistryProvider() {
            @Override
            public MetricsRegistry create() {
                return MetricsRegistry.noop();
            }

            @Override
            public int priority() {
                return priority;
            }

            @Override
            public String name() {
                return name;
            }
        };
    }
}
