package com.sylva.codegen.infra.telemetry;

import io.opentelemetry.api.trace.Span;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TracingServiceTest {

    @Test
    @DisplayName("Noop instance hands out non-recording spans")
    void noopInstance() {
        TracingService service = TracingService.noop();

        Span span = service.getTracer().spanBuilder("convert-ensemble").startSpan();
        assertThat(service.isEnabled()).isFalse();
        assertThat(span.isRecording()).isFalse();
        span.end();
        service.shutdown();
    }

    @Test
    @DisplayName("Disabling via property yields a noop instance")
    void disabledByProperty() {
        String previous = System.getProperty("OTEL_DISABLED");
        System.setProperty("OTEL_DISABLED", "true");
        try {
            assertThat(TracingService.create().isEnabled()).isFalse();
        } finally {
            if (previous == null) {
                System.clearProperty("OTEL_DISABLED");
            } else {
                System.setProperty("OTEL_DISABLED", previous);
            }
        }
    }

    @Test
    @DisplayName("SDK instance records spans until shut down")
    void sdkInstanceRecords() {
        String previous = System.getProperty("OTEL_DISABLED");
        System.clearProperty("OTEL_DISABLED");
        try {
            TracingService service = TracingService.create();
            // The environment may still disable tracing.
            if (service.isEnabled()) {
                Span span = service.getTracer().spanBuilder("build-ensemble").startSpan();
                assertThat(span.isRecording()).isTrue();
                span.end();
            }
            service.shutdown();
        } finally {
            if (previous != null) {
                System.setProperty("OTEL_DISABLED", previous);
            }
        }
    }
}
