package com.phillippitts.draftsmith.domain.iteration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One accepted step in an iteration's history.
 *
 * @param sequence 1-based position in the history
 * @param cycle cycle the step belongs to
 * @param kind step kind
 * @param payload immutable copy of the submitted payload
 */
public record IterationHistoryEntry(int sequence, int cycle, StepKind kind, Map<String, Object> payload) {

    public IterationHistoryEntry {
        Objects.requireNonNull(kind, "kind");
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
