package com.phillippitts.draftsmith.service.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A failed backend attempt.
 *
 * @param code fault code
 * @param message human-readable description (raw backend message for classified errors)
 * @param recoverable whether retrying the same backend may succeed
 * @param provider backend the fault came from
 * @param details auxiliary detail such as {@code originalError} or {@code allErrors}
 */
public record ProviderFault(ProviderFaultCode code,
                            String message,
                            boolean recoverable,
                            BackendKind provider,
                            Map<String, Object> details) {

    public static final String DETAIL_ORIGINAL_ERROR = "originalError";
    public static final String DETAIL_ALL_ERRORS = "allErrors";

    public ProviderFault {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ProviderFault notFound(BackendKind key) {
        return new ProviderFault(ProviderFaultCode.PROVIDER_NOT_FOUND,
                "Provider \"" + key.key() + "\" not found", false, key, Map.of());
    }

    public static ProviderFault notConfigured(BackendKind key) {
        return new ProviderFault(ProviderFaultCode.PROVIDER_NOT_CONFIGURED,
                "Provider \"" + key.key() + "\" is not properly configured", true, key, Map.of());
    }

    /**
     * Fault for an exception thrown by a backend call, classified by its message.
     */
    public static ProviderFault fromError(BackendKind key, String errorMessage) {
        String msg = errorMessage == null ? "Unknown provider error" : errorMessage;
        return new ProviderFault(ProviderFaultCode.classify(msg), msg, true, key,
                Map.of(DETAIL_ORIGINAL_ERROR, msg));
    }

    /** Copy of this fault with one more detail entry. */
    public ProviderFault withDetail(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.put(key, value);
        return new ProviderFault(code, message, recoverable, provider, merged);
    }
}
