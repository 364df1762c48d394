package com.phillippitts.draftsmith.service.provider;

import java.util.Objects;

/**
 * Prompt and sampling options of a request.
 *
 * @param prompt raw prompt text
 * @param mode request purpose
 * @param maxTokens output cap, or null for the hub default
 * @param temperature sampling temperature, or null for the hub default
 */
public record ProviderPayload(String prompt, ProviderMode mode, Integer maxTokens, Double temperature) {

    public ProviderPayload {
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(mode, "mode");
    }

    public static ProviderPayload of(String prompt, ProviderMode mode) {
        return new ProviderPayload(prompt, mode, null, null);
    }
}
