package com.phillippitts.draftsmith.service.provider;

/** One failed attempt recorded under {@link ProviderFault#DETAIL_ALL_ERRORS}. */
public record FallbackAttempt(BackendKind provider, ProviderFault fault) {
}
