package com.phillippitts.draftsmith.domain;

/**
 * Fault reported by an external collaborator (template catalog, persona catalog, session storage).
 *
 * @param code machine-readable code, e.g. {@code template_not_found} or {@code storage_error}
 * @param message human-readable description
 */
public record CollaboratorFault(String code, String message) {

    public static CollaboratorFault of(String code, String message) {
        return new CollaboratorFault(code, message);
    }
}
