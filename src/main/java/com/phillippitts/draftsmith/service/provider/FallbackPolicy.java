package com.phillippitts.draftsmith.service.provider;

import com.phillippitts.draftsmith.config.properties.ProviderProperties;
import com.phillippitts.draftsmith.exception.UnknownBackendException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Retry and failover policy applied by the {@code *WithFallback} hub operations.
 *
 * @param enabled when false, or when {@code order} is empty, fallback calls behave like direct calls
 * @param order backends tried after the requested one
 * @param maxRetries extra attempts per backend after the first
 * @param retryDelay pause between attempts on the same backend
 */
public record FallbackPolicy(boolean enabled, List<BackendKind> order, int maxRetries, Duration retryDelay) {

    public static final FallbackPolicy DISABLED = new FallbackPolicy(false, List.of(), 0, Duration.ZERO);

    public FallbackPolicy {
        order = order == null ? List.of() : List.copyOf(order);
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
        }
        Objects.requireNonNull(retryDelay, "retryDelay");
    }

    /** True when fallback traversal applies at all. */
    public boolean isActive() {
        return enabled && !order.isEmpty();
    }

    /**
     * Builds a policy from configuration.
     *
     * @throws UnknownBackendException if the order names an unsupported backend
     */
    public static FallbackPolicy from(ProviderProperties.Fallback props) {
        List<BackendKind> keys = new ArrayList<>();
        for (String raw : props.getOrder()) {
            keys.add(BackendKind.fromKey(raw).orElseThrow(() -> new UnknownBackendException(raw)));
        }
        return new FallbackPolicy(props.isEnabled(), keys, props.getMaxRetries(),
                Duration.ofMillis(props.getRetryDelayMs()));
    }
}
