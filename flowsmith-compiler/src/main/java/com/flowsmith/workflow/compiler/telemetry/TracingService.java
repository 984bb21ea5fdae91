/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * OpenTelemetry setup for the compiler.
 *
 * <p>Compilation is short-lived and synchronous, so the logging exporter
 * writes each span as it ends; OTLP export is batched and drained on
 * {@link #shutdown()}.
 *
 * Configuration via environment variables (or system properties of the same name):
 * - OTEL_DISABLED: disable tracing entirely (default: false)
 * - OTEL_EXPORTER_TYPE: logging|otlp (default: logging)
 * - OTEL_EXPORTER_OTLP_ENDPOINT: OTLP endpoint (default: http://localhost:4317)
 * - OTEL_TRACE_SAMPLING_RATIO: 0.0-1.0 (default: 1.0)
 * - OTEL_SERVICE_NAME: service identifier (default: flowsmith-compiler)
 */
public class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    public static final String INSTRUMENTATION_NAME = "com.flowsmith.workflow-compiler";
    private static final String DEFAULT_SERVICE_NAME = "flowsmith-compiler";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

    private static volatile TracingService instance;
    private static final Object LOCK = new Object();

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;

    private TracingService(OpenTelemetry openTelemetry, SdkTracerProvider tracerProvider) {
        this.openTelemetry = openTelemetry;
        this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
        this.tracerProvider = tracerProvider;
    }

    /**
     * Process-wide instance configured from the environment.
     */
    public static TracingService getInstance() {
        TracingService current = instance;
        if (current == null) {
            synchronized (LOCK) {
                current = instance;
                if (current == null) {
                    current = create(System.getenv());
                    instance = current;
                }
            }
        }
        return current;
    }

    public static TracingService noop() {
        return new TracingService(OpenTelemetry.noop(), null);
    }

    /**
     * Builds a service from the given environment. Falls back to noop if the
     * SDK cannot be initialized.
     */
    static TracingService create(Map<String, String> environment) {
        if (Boolean.parseBoolean(setting(environment, "OTEL_DISABLED", "false"))) {
            logger.info("OpenTelemetry tracing is disabled (OTEL_DISABLED=true)");
            return noop();
        }
        try {
            Resource resource = Resource.getDefault().merge(Resource.create(Attributes.builder()
                    .put(SERVICE_NAME, setting(environment, "OTEL_SERVICE_NAME", DEFAULT_SERVICE_NAME))
                    .put(SERVICE_VERSION, setting(environment, "OTEL_SERVICE_VERSION", "unknown"))
                    .build()));
            Sampler sampler = Sampler.parentBased(
                    Sampler.traceIdRatioBased(samplingRatio(setting(environment, "OTEL_TRACE_SAMPLING_RATIO", "1.0"))));

            SdkTracerProvider provider = SdkTracerProvider.builder()
                    .setResource(resource)
                    .setSampler(sampler)
                    .addSpanProcessor(spanProcessor(environment))
                    .build();
            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(provider)
                    .build();
            logger.fine("OpenTelemetry initialized with sampler " + sampler.getDescription());
            return new TracingService(sdk, provider);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to initialize OpenTelemetry, falling back to noop", e);
            return noop();
        }
    }

    private static double samplingRatio(String value) {
        try {
            return Math.max(0.0, Math.min(1.0, Double.parseDouble(value)));
        } catch (NumberFormatException e) {
            logger.warning("Invalid OTEL_TRACE_SAMPLING_RATIO: " + value + ", sampling everything");
            return 1.0;
        }
    }

    private static SpanProcessor spanProcessor(Map<String, String> environment) {
        String exporterType = setting(environment, "OTEL_EXPORTER_TYPE", "logging").toLowerCase(Locale.ROOT);
        switch (exporterType) {
            case "otlp":
                String endpoint = setting(environment, "OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317");
                logger.info("Using OTLP span exporter: " + endpoint);
                return BatchSpanProcessor.builder(OtlpGrpcSpanExporter.builder()
                        .setEndpoint(endpoint)
                        .setTimeout(30, TimeUnit.SECONDS)
                        .build()).build();
            case "logging":
                return SimpleSpanProcessor.create(LoggingSpanExporter.create());
            default:
                logger.warning("Unknown exporter type: " + exporterType + ", using logging");
                return SimpleSpanProcessor.create(LoggingSpanExporter.create());
        }
    }

    private static String setting(Map<String, String> environment, String key, String defaultValue) {
        String value = environment.get(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }

    /**
     * Flushes pending spans and releases exporter resources.
     */
    public void shutdown() {
        if (tracerProvider == null) {
            return;
        }
        try {
            tracerProvider.shutdown().join(10, TimeUnit.SECONDS);
        } catch (RuntimeException e) {
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
        return tracerProvider != null;
    }
}
