package com.phillippitts.draftsmith.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link GenerationException} with contextual metadata.
 *
 * <pre>
 * throw GenerationExceptionBuilder.create("Chat completion failed")
 *         .backend("openai")
 *         .cause(e)
 *         .durationMs(1200)
 *         .metadata("model", "gpt-4o-mini")
 *         .build();
 * </pre>
 */
public final class GenerationExceptionBuilder {

    private final String message;
    private String backend;
    private Throwable cause;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private GenerationExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * @param message base error message (must not be null or empty)
     */
    public static GenerationExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new GenerationExceptionBuilder(message);
    }

    public GenerationExceptionBuilder backend(String backend) {
        this.backend = backend;
        return this;
    }

    public GenerationExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public GenerationExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a key-value pair to the message suffix. Null keys or values are ignored.
     */
    public GenerationExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * {@code {message}: {causeMessage} (durationMs={ms}, {key}={value}, ...)}.
     * The cause message is appended so that substring classification in the hub
     * sees "timeout", "rate limit" or "network" reported by the underlying client.
     */
    public GenerationException build() {
        String detailed = buildDetailedMessage();
        String name = backend != null ? backend : "unknown";
        return cause != null
                ? new GenerationException(detailed, name, cause)
                : new GenerationException(detailed, name);
    }

    private String buildDetailedMessage() {
        StringBuilder sb = new StringBuilder(message);
        if (cause != null && cause.getMessage() != null && !cause.getMessage().isBlank()) {
            sb.append(": ").append(cause.getMessage());
        }
        if (durationMs == null && metadata.isEmpty()) {
            return sb.toString();
        }
        StringBuilder details = new StringBuilder();
        if (durationMs != null) {
            details.append("durationMs=").append(durationMs);
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (details.length() > 0) {
                details.append(", ");
            }
            details.append(entry.getKey()).append('=').append(entry.getValue());
        }
        return sb.append(" (").append(details).append(')').toString();
    }
}
