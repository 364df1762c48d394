package com.phillippitts.draftsmith.exception;

/**
 * Thrown by a text-generation backend adapter when a call fails.
 * The provider hub catches it and classifies the message into a provider fault.
 */
public class GenerationException extends DraftsmithException {

    private final String backend;

    public GenerationException(String message) {
        super(message);
        this.backend = "unknown";
    }

    public GenerationException(String message, String backend) {
        super(message + " (backend: " + backend + ")");
        this.backend = backend;
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
        this.backend = "unknown";
    }

    public GenerationException(String message, String backend, Throwable cause) {
        super(message + " (backend: " + backend + ")", cause);
        this.backend = backend;
    }

    public String getBackend() {
        return backend;
    }
}
