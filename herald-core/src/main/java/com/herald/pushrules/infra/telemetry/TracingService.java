/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.infra.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * OpenTelemetry tracing for the push pipeline.
 *
 * Configuration via environment variables (or system properties):
 * - OTEL_DISABLED: Disable tracing entirely (default: false)
 * - OTEL_EXPORTER_TYPE: otlp|logging (default: logging)
 * - OTEL_EXPORTER_OTLP_ENDPOINT: OTLP endpoint (default: http://localhost:4317)
 * - OTEL_TRACE_SAMPLING_RATIO: 0.0-1.0 (default depends on DEPLOYMENT_ENVIRONMENT)
 * - SERVICE_NAME: Service identifier (default: herald-push-rules)
 * - DEPLOYMENT_ENVIRONMENT: prod|staging|dev (default: dev)
 */
public class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    private static final String INSTRUMENTATION_NAME = "com.herald.push-rules";
    private static final String DEFAULT_SERVICE_NAME = "herald-push-rules";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> DEPLOYMENT_ENVIRONMENT = AttributeKey.stringKey("deployment.environment");

    private static volatile TracingService INSTANCE;
    private static final Object LOCK = new Object();

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;
    private final boolean isNoop;

    private TracingService(OpenTelemetry openTelemetry, Tracer tracer,
                           SdkTracerProvider tracerProvider, boolean isNoop) {
        this.openTelemetry = openTelemetry;
        this.tracer = tracer;
        this.tracerProvider = tracerProvider;
        this.isNoop = isNoop;
    }

    /**
     * Get the process-wide instance with double-checked locking.
     */
    public static TracingService getInstance() {
        TracingService instance = INSTANCE;
        if (instance == null) {
            synchronized (LOCK) {
                instance = INSTANCE;
                if (instance == null) {
                    instance = initialize();
                    INSTANCE = instance;
                }
            }
        }
        return instance;
    }

    /**
     * A tracing service that records nothing.
     */
    public static TracingService disabled() {
        OpenTelemetry noop = OpenTelemetry.noop();
        return new TracingService(noop, noop.getTracer(INSTRUMENTATION_NAME), null, true);
    }

    private static TracingService initialize() {
        try {
            if (Boolean.parseBoolean(getEnvOrProperty("OTEL_DISABLED", "false"))) {
                logger.info("OpenTelemetry tracing is DISABLED (OTEL_DISABLED=true)");
                return disabled();
            }

            Resource resource = Resource.getDefault().merge(Resource.create(Attributes.builder()
                    .put(SERVICE_NAME, getEnvOrProperty("SERVICE_NAME", DEFAULT_SERVICE_NAME))
                    .put(DEPLOYMENT_ENVIRONMENT, getEnvironment())
                    .build()));

            Sampler sampler = configureSampler();

            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .setResource(resource)
                    .setSampler(sampler)
                    .addSpanProcessor(BatchSpanProcessor.builder(configureExporter())
                            .setMaxQueueSize(8192)
                            .setMaxExportBatchSize(512)
                            .setScheduleDelay(Duration.ofSeconds(5))
                            .setExporterTimeout(Duration.ofSeconds(30))
                            .build())
                    .build();

            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(tracerProvider)
                    .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                    .build();

            logger.info(String.format("OpenTelemetry initialized: env=%s, sampler=%s",
                    getEnvironment(), sampler.getDescription()));

            TracingService service = new TracingService(sdk, sdk.getTracer(INSTRUMENTATION_NAME), tracerProvider, false);
            Runtime.getRuntime().addShutdownHook(new Thread(service::shutdown, "otel-shutdown-hook"));
            return service;
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to initialize OpenTelemetry - falling back to noop", e);
            return disabled();
        }
    }

    private static Sampler configureSampler() {
        String defaultRatio = switch (getEnvironment().toLowerCase()) {
            case "prod", "production" -> "0.1";
            case "staging" -> "0.5";
            default -> "1.0";
        };
        double samplingRatio;
        try {
            samplingRatio = Double.parseDouble(getEnvOrProperty("OTEL_TRACE_SAMPLING_RATIO", defaultRatio));
            samplingRatio = Math.max(0.0, Math.min(1.0, samplingRatio));
        } catch (NumberFormatException e) {
            logger.warning("Invalid OTEL_TRACE_SAMPLING_RATIO, using default");
            samplingRatio = Double.parseDouble(defaultRatio);
        }
        return Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(samplingRatio)).build();
    }

    private static SpanExporter configureExporter() {
        String exporterType = getEnvOrProperty("OTEL_EXPORTER_TYPE", "logging").toLowerCase();
        if ("otlp".equals(exporterType)) {
            String endpoint = getEnvOrProperty("OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317");
            logger.info("Using OTLP exporter: " + endpoint);
            return OtlpGrpcSpanExporter.builder()
                    .setEndpoint(endpoint)
                    .setTimeout(30, TimeUnit.SECONDS)
                    .build();
        }
        if (!"logging".equals(exporterType)) {
            logger.warning("Unknown exporter type: " + exporterType + ", using logging");
        }
        return LoggingSpanExporter.create();
    }

    /**
     * Graceful shutdown with timeout.
     */
    public void shutdown() {
        if (isNoop || tracerProvider == null) {
            return;
        }
        try {
            logger.info("Draining span buffer...");
            tracerProvider.shutdown().join(30, TimeUnit.SECONDS);
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error during OpenTelemetry shutdown", e);
        }
    }

    public Tracer getTracer() {
        return tracer;
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public boolean isEnabled() {
        return !isNoop;
    }

    private static String getEnvironment() {
        return getEnvOrProperty("DEPLOYMENT_ENVIRONMENT", "dev");
    }

    private static String getEnvOrProperty(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }
}
