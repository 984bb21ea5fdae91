/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.telemetry;

import io.opentelemetry.api.trace.Span;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TracingServiceTest {

    @Test
    @DisplayName("Should return a noop service when tracing is disabled")
    void shouldHonorDisabledFlag() {
        TracingService service = TracingService.create(Map.of("OTEL_DISABLED", "true"));

        assertThat(service.isEnabled()).isFalse();
        Span span = service.getTracer().spanBuilder("ignored").startSpan();
        assertThat(span.getSpanContext().isValid()).isFalse();
        span.end();
        service.shutdown();
    }

    @Test
    @DisplayName("Should record spans with the logging exporter by default")
    void shouldRecordSpans() {
        TracingService service = TracingService.create(Map.of("OTEL_SERVICE_NAME", "flowsmith-test"));
        try {
            assertThat(service.isEnabled()).isTrue();
            Span span = service.getTracer().spanBuilder("compile-workflow").startSpan();
            assertThat(span.getSpanContext().isValid()).isTrue();
            assertThat(span.getSpanContext().isSampled()).isTrue();
            span.end();
        } finally {
            service.shutdown();
        }
    }

    @Test
    @DisplayName("Should not sample when the ratio is zero")
    void shouldApplySamplingRatio() {
        TracingService service = TracingService.create(Map.of("OTEL_TRACE_SAMPLING_RATIO", "0"));
        try {
            Span span = service.getTracer().spanBuilder("unsampled").startSpan();
            assertThat(span.getSpanContext().isSampled()).isFalse();
            span.end();
        } finally {
            service.shutdown();
        }
    }
}
