package com.herald.pushrules.infra.metrics.impl.prometheus;

import com.herald.pushrules.infra.metrics.Counter;
import com.herald.pushrules.infra.metrics.Gauge;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PrometheusMetricsRegistryTest {

    private CollectorRegistry collectorRegistry;
    private PrometheusMetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        collectorRegistry = new CollectorRegistry();
        metrics = new PrometheusMetricsRegistry(collectorRegistry);
    }

    @Test
    void counter_isRegisteredAndShared() {
        Counter hits = metrics.counter("room_rules_cache_hits");
        hits.increment();
        metrics.counter("room_rules_cache_hits").increment(2);

        assertThat(hits.count()).isEqualTo(3L);
        assertThat(collectorRegistry.getSampleValue("room_rules_cache_hits_total")).isEqualTo(3.0);
    }

    @Test
    void counter_withTags_usesLabels() {
        metrics.counter("push_rules_notifications", "room_version", "10").increment();

        assertThat(collectorRegistry.getSampleValue("push_rules_notifications_total",
                new String[] { "room_version" }, new String[] { "10" })).isEqualTo(1.0);
    }

    @Test
    void gauge_reportsLastValue() {
        Gauge size = metrics.gauge("room_rules_cache_size");
        size.set(12);
        size.set(7);

        assertThat(size.value()).isEqualTo(7.0);
        assertThat(collectorRegistry.getSampleValue("room_rules_cache_size")).isEqualTo(7.0);
    }

    @Test
    void sanitizeName_replacesInvalidCharacters() {
        assertThat(PrometheusMetricsRegistry.sanitizeName("Room-Rules.Cache  Hits")).isEqualTo("room_rules_cache_hits");
    }
}
