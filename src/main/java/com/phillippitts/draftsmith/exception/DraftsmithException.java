package com.phillippitts.draftsmith.exception;

/**
 * Base exception for draftsmith errors that are not expressed as fault values.
 * Programming and configuration errors surface as subclasses of this type.
 */
public class DraftsmithException extends RuntimeException {

    public DraftsmithException(String message) {
        super(message);
    }

    public DraftsmithException(String message, Throwable cause) {
        super(message, cause);
    }

    public DraftsmithException(Throwable cause) {
        super(cause);
    }
}
