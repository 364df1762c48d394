package com.phillippitts.draftsmith.service.orchestration.event;

import java.time.Instant;

/** Published when a session snapshot could not be written to storage. The session itself stays valid in memory. */
public record SessionPersistenceFailedEvent(String sessionId, String code, String message, Instant at) { }
