package com.phillippitts.draftsmith.service.provider;

import java.util.Iterator;

/**
 * Backend model adapter invoked by the hub. Implementations may block; the hub enforces the timeout.
 *
 * <p>Failures are reported by throwing; the hub classifies the exception message into a
 * {@link ProviderFaultCode}. Adapters should keep the underlying client's wording ("timeout",
 * "rate limit", "network") in the message.
 */
public interface TextGenerationModel {

    /**
     * Generates a complete response.
     *
     * @param prompt fully composed prompt
     * @param temperature sampling temperature
     * @param maxTokens output token cap
     * @return generated response
     */
    ProviderResponse generate(String prompt, double temperature, int maxTokens);

    /**
     * Starts a streamed generation. The returned iterator yields text deltas and may throw from
     * {@code hasNext()}/{@code next()} when the backend fails mid-stream.
     */
    Iterator<String> stream(String prompt, double temperature, int maxTokens);

    /** Model name for logs and responses. */
    default String modelName() {
        return "unknown";
    }
}
