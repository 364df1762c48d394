package com.phillippitts.draftsmith.domain.session;

import com.phillippitts.draftsmith.domain.iteration.StepKind;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Audit entry for one accepted {@code resumeSession} call.
 */
public record StepRecord(String stepId,
                         String sessionId,
                         StepKind kind,
                         Map<String, Object> input,
                         StepOutput output,
                         Instant timestamp,
                         long durationMs) {

    public StepRecord {
        Objects.requireNonNull(stepId, "stepId");
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(timestamp, "timestamp");
        input = input == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(input));
    }
}
