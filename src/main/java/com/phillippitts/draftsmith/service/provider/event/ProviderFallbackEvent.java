package com.phillippitts.draftsmith.service.provider.event;

import java.time.Instant;

/** Published when a request is served by a backend other than the one it named. */
public record ProviderFallbackEvent(String requested, String servedBy, int failedAttempts, Instant at) { }
