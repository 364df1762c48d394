package com.phillippitts.draftsmith.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for backend calls.
 *
 * <p>Provides:
 * <ul>
 *   <li>Call latency per backend</li>
 *   <li>Success and failure counts per backend, failures tagged with the fault code</li>
 *   <li>Token consumption per backend</li>
 *   <li>Fallback outcomes (served by an alternate backend, or exhausted)</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class ProviderMetrics {

    private static final String METRIC_PREFIX = "draftsmith.provider";

    private final MeterRegistry registry;

    public ProviderMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param backend backend key (openai, gemini-api, ...)
     * @param durationNanos call duration in nanoseconds
     */
    public void recordLatency(String backend, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken by a backend call")
                .tag("backend", backend)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String backend) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful backend calls")
                .tag("backend", backend)
                .register(registry)
                .increment();
    }

    /**
     * @param backend backend key
     * @param reason provider fault code (timeout, rate_limit_exceeded, ...)
     */
    public void incrementFailure(String backend, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed backend calls")
                .tag("backend", backend)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordTokens(String backend, long tokens) {
        Counter.builder(METRIC_PREFIX + ".tokens")
                .description("Tokens consumed by backend calls")
                .tag("backend", backend)
                .register(registry)
                .increment(tokens);
    }

    /**
     * @param requested backend named by the request
     * @param outcome backend key that served the request, or "exhausted"
     */
    public void recordFallback(String requested, String outcome) {
        Counter.builder(METRIC_PREFIX + ".fallback")
                .description("Number of requests not served by the requested backend")
                .tag("requested", requested)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
