package com.phillippitts.draftsmith.service.provider;

import java.util.Objects;

/**
 * A generation request addressed to a preferred backend.
 *
 * @param key preferred backend
 * @param payload prompt and options
 * @param templateContext optional enrichment, may be null
 */
public record ProviderRequest(BackendKind key, ProviderPayload payload, TemplateContext templateContext) {

    public ProviderRequest {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(payload, "payload");
    }

    public static ProviderRequest of(BackendKind key, ProviderPayload payload) {
        return new ProviderRequest(key, payload, null);
    }

    /** Same request routed to another backend. */
    public ProviderRequest withKey(BackendKind other) {
        return new ProviderRequest(other, payload, templateContext);
    }
}
