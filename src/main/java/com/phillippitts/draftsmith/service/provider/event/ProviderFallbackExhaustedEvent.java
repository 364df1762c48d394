package com.phillippitts.draftsmith.service.provider.event;

import java.time.Instant;

/** Published when every backend and retry failed. */
public record ProviderFallbackExhaustedEvent(String requested, String lastFaultCode, int attempts, Instant at) { }
