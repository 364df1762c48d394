package com.phillippitts.draftsmith.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderMetricsTest {

    private MeterRegistry registry;
    private ProviderMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ProviderMetrics(registry);
    }

    @Test
    void shouldRecordLatencyPerBackend() {
        long durationNanos = TimeUnit.MILLISECONDS.toNanos(250);

        metrics.recordLatency("openai", durationNanos);

        Timer timer = registry.find("draftsmith.provider.latency").tag("backend", "openai").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(durationNanos);
    }

    @Test
    void shouldCountSuccessesAndFailuresSeparately() {
        metrics.incrementSuccess("gemini-api");
        metrics.incrementSuccess("gemini-api");
        metrics.incrementFailure("gemini-api", "timeout");

        Counter success = registry.find("draftsmith.provider.success").tag("backend", "gemini-api").counter();
        Counter failure = registry.find("draftsmith.provider.failure")
                .tag("backend", "gemini-api").tag("reason", "timeout").counter();
        assertThat(success.count()).isEqualTo(2.0);
        assertThat(failure.count()).isEqualTo(1.0);
    }

    @Test
    void shouldAccumulateTokens() {
        metrics.recordTokens("lmtapi", 120);
        metrics.recordTokens("lmtapi", 30);

        Counter tokens = registry.find("draftsmith.provider.tokens").tag("backend", "lmtapi").counter();
        assertThat(tokens.count()).isEqualTo(150.0);
    }

    @Test
    void shouldTagFallbackOutcome() {
        metrics.recordFallback("openai", "gemini-api");
        metrics.recordFallback("openai", "exhausted");

        assertThat(registry.find("draftsmith.provider.fallback").tag("outcome", "exhausted").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("draftsmith.provider.fallback").tag("requested", "openai").counters()).hasSize(2);
    }
}
