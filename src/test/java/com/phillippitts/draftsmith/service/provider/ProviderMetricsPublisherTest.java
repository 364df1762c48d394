package com.phillippitts.draftsmith.service.provider;

import com.phillippitts.draftsmith.service.metrics.ProviderMetrics;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ProviderMetricsPublisherTest {

    @Test
    void noopIgnoresEveryCall() {
        assertThat(ProviderMetricsPublisher.NOOP.isEnabled()).isFalse();
        assertThatCode(() -> {
            ProviderMetricsPublisher.NOOP.recordSuccess(BackendKind.OPENAI, 1_000, 10);
            ProviderMetricsPublisher.NOOP.recordFailure(BackendKind.OPENAI, 1_000, ProviderFaultCode.TIMEOUT);
            ProviderMetricsPublisher.NOOP.recordFallbackServed(BackendKind.OPENAI, BackendKind.LMTAPI);
            ProviderMetricsPublisher.NOOP.recordFallbackExhausted(BackendKind.OPENAI);
        }).doesNotThrowAnyException();
    }

    @Test
    void forwardsToMetricsWithBackendKeys() {
        ProviderMetrics metrics = mock(ProviderMetrics.class);
        ProviderMetricsPublisher publisher = new ProviderMetricsPublisher(metrics);

        publisher.recordSuccess(BackendKind.GEMINI_API, 5_000, 0);
        publisher.recordFailure(BackendKind.OPENAI, 7_000, ProviderFaultCode.RATE_LIMIT_EXCEEDED);
        publisher.recordFallbackServed(BackendKind.OPENAI, BackendKind.GEMINI_API);
        publisher.recordFallbackExhausted(BackendKind.LMTAPI);

        verify(metrics).recordLatency("gemini-api", 5_000);
        verify(metrics).incrementSuccess("gemini-api");
        verify(metrics, never()).recordTokens("gemini-api", 0);
        verify(metrics).incrementFailure("openai", "rate_limit_exceeded");
        verify(metrics).recordFallback("openai", "gemini-api");
        verify(metrics).recordFallback("lmtapi", "exhausted");
    }
}
