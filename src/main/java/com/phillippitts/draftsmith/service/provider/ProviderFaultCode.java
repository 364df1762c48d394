package com.phillippitts.draftsmith.service.provider;

/** Provider fault taxonomy. Only {@link #PROVIDER_NOT_FOUND} is non-recoverable. */
public enum ProviderFaultCode {
    PROVIDER_NOT_FOUND("provider_not_found", false),
    PROVIDER_NOT_CONFIGURED("provider_not_configured", true),
    PROVIDER_ERROR("provider_error", true),
    RATE_LIMIT_EXCEEDED("rate_limit_exceeded", true),
    TIMEOUT("timeout", true),
    NETWORK_ERROR("network_error", true);

    private final String wireName;
    private final boolean recoverable;

    ProviderFaultCode(String wireName, boolean recoverable) {
        this.wireName = wireName;
        this.recoverable = recoverable;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isRecoverable() {
        return recoverable;
    }

    /**
     * Maps a raw backend error message onto a code by substring, first match wins:
     * "timeout", "rate limit", "network", otherwise {@link #PROVIDER_ERROR}.
     */
    public static ProviderFaultCode classify(String errorMessage) {
        if (errorMessage == null) {
            return PROVIDER_ERROR;
        }
        if (errorMessage.contains("timeout")) {
            return TIMEOUT;
        }
        if (errorMessage.contains("rate limit")) {
            return RATE_LIMIT_EXCEEDED;
        }
        if (errorMessage.contains("network")) {
            return NETWORK_ERROR;
        }
        return PROVIDER_ERROR;
    }
}
