package com.phillippitts.draftsmith.exception;

/**
 * Thrown at startup when configuration names a backend key outside the supported set.
 */
public class UnknownBackendException extends DraftsmithException {

    private final String key;

    public UnknownBackendException(String key) {
        super("Unknown backend key: '" + key + "'. Supported keys: openai, gemini-api, gemini-cli, lmtapi");
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
