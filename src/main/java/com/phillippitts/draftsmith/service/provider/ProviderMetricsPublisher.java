package com.phillippitts.draftsmith.service.provider;

import com.phillippitts.draftsmith.service.metrics.ProviderMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Records backend call outcomes to {@link ProviderMetrics}, tolerating a missing metrics service.
 *
 * <p>The hub always calls this publisher; when it is built without metrics (tests, builder
 * defaults) every method is a no-op.
 *
 * @see ProviderMetrics
 */
@Component
public final class ProviderMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(ProviderMetricsPublisher.class);

    /** No-op instance for tests and hubs built without a meter registry. */
    public static final ProviderMetricsPublisher NOOP = new ProviderMetricsPublisher(null);

    private final ProviderMetrics metrics;

    /**
     * @param metrics metrics service, nullable
     */
    public ProviderMetricsPublisher(ProviderMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("ProviderMetricsPublisher created without metrics");
        }
    }

    public void recordSuccess(BackendKind backend, long durationNanos, long tokens) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(backend.key(), durationNanos);
        metrics.incrementSuccess(backend.key());
        if (tokens > 0) {
            metrics.recordTokens(backend.key(), tokens);
        }
    }

    public void recordFailure(BackendKind backend, long durationNanos, ProviderFaultCode code) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(backend.key(), durationNanos);
        metrics.incrementFailure(backend.key(), code.wireName());
    }

    public void recordFallbackServed(BackendKind requested, BackendKind servedBy) {
        if (metrics == null) {
            return;
        }
        metrics.recordFallback(requested.key(), servedBy.key());
    }

    public void recordFallbackExhausted(BackendKind requested) {
        if (metrics == null) {
            return;
        }
        metrics.recordFallback(requested.key(), "exhausted");
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
