package com.phillippitts.draftsmith.service.provider;

import java.util.Objects;

/**
 * Completed generation.
 *
 * @param content generated text
 * @param usage token accounting, or null when the backend does not report it
 * @param model model name reported by the backend, or null
 * @param finishReason backend finish reason, or null
 */
public record ProviderResponse(String content, TokenUsage usage, String model, String finishReason) {

    public ProviderResponse {
        Objects.requireNonNull(content, "content");
    }

    public static ProviderResponse of(String content) {
        return new ProviderResponse(content, null, null, null);
    }

    int totalTokens() {
        return usage == null ? 0 : usage.totalTokens();
    }
}
