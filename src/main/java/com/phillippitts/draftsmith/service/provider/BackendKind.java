package com.phillippitts.draftsmith.service.provider;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of text-generation backends the hub can route to.
 */
public enum BackendKind {
    OPENAI("openai"),
    GEMINI_API("gemini-api"),
    GEMINI_CLI("gemini-cli"),
    LMTAPI("lmtapi");

    private final String key;

    BackendKind(String key) {
        this.key = key;
    }

    /** Configuration and wire key, e.g. {@code gemini-api}. */
    public String key() {
        return key;
    }

    public static Optional<BackendKind> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(k -> k.key.equals(normalized))
                .findFirst();
    }
}
