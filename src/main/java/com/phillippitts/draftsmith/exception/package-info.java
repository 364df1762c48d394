/**
 * Exceptions for programming, configuration and backend adapter failures.
 *
 * <p>Operational outcomes (validation failures, unknown sessions, backend faults) are returned as
 * fault values inside a {@link com.phillippitts.draftsmith.domain.Result}; exceptions in this
 * package are reserved for conditions callers are not expected to handle.
 *
 * <ul>
 *   <li>{@link com.phillippitts.draftsmith.exception.DraftsmithException} - base type</li>
 *   <li>{@link com.phillippitts.draftsmith.exception.GenerationException} - a backend call failed;
 *       caught by the provider hub and classified into a provider fault</li>
 *   <li>{@link com.phillippitts.draftsmith.exception.UnknownBackendException} - configuration
 *       names an unsupported backend key</li>
 * </ul>
 */
package com.phillippitts.draftsmith.exception;
