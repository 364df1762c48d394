package com.phillippitts.draftsmith.service.provider;

import com.phillippitts.draftsmith.domain.Result;

import java.util.List;

/**
 * Executes generation requests against interchangeable backends.
 *
 * <p>Every operation returns a {@link Result}; backend failures are never thrown. Request
 * statistics are kept per registered backend and are only mutated by this hub.
 *
 * <p><b>Fallback:</b> the {@code *WithFallback} variants try the requested backend first, then
 * each configured fallback backend not yet tried. Each backend gets up to {@code maxRetries + 1}
 * attempts, a non-recoverable fault moves on to the next backend immediately, and the configured
 * delay is applied only between attempts on the same backend. If every attempt fails, the last
 * fault is returned with the full attempt list under {@link ProviderFault#DETAIL_ALL_ERRORS}.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * ProviderRequest request = ProviderRequest.of(BackendKind.OPENAI,
 *         ProviderPayload.of("Outline a talk on caching", ProviderMode.OUTLINE));
 * Result<ProviderResponse, ProviderFault> result = hub.executeWithFallback(request);
 * if (result.isOk()) {
 *     String text = result.getValue().content();
 * }
 * }</pre>
 *
 * <p><b>Thread Safety:</b> implementations must be thread-safe.
 *
 * @since 1.0
 */
public interface ProviderHub {

    /**
     * Registers a backend. Re-registering a key replaces its channel and keeps its statistics;
     * registration order is preserved for statistics listing.
     */
    void registerProvider(ProviderChannel channel);

    /**
     * Executes a request against exactly the backend it names, bounded by the configured timeout.
     *
     * @return the response, or {@code provider_not_found}, {@code provider_not_configured}, or a
     *         classified backend fault
     */
    Result<ProviderResponse, ProviderFault> execute(ProviderRequest request);

    /** {@link #execute(ProviderRequest)} wrapped in the configured fallback policy. */
    Result<ProviderResponse, ProviderFault> executeWithFallback(ProviderRequest request);

    /**
     * Starts a streamed generation. The timeout bounds stream creation; success statistics are
     * recorded once the stream has been fully consumed.
     */
    Result<ProviderStream, ProviderFault> stream(ProviderRequest request);

    /** {@link #stream(ProviderRequest)} wrapped in the configured fallback policy. */
    Result<ProviderStream, ProviderFault> streamWithFallback(ProviderRequest request);

    /** Statistics for every registered backend, in registration order. */
    List<BackendStatistics> getStatistics();

    /** Statistics for one backend; empty if it was never registered. */
    List<BackendStatistics> getStatistics(BackendKind key);

    /** True if the backend is registered and reports itself configured. */
    boolean isConfigured(BackendKind key);

    /** Registered backend keys in registration order. */
    List<BackendKind> registeredProviders();
}
