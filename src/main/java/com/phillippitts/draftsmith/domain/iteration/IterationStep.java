package com.phillippitts.draftsmith.domain.iteration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A step submitted by the caller: its kind plus an opaque payload.
 *
 * <p>The orchestrator reads a few optional payload keys ({@code prompt}, {@code provider},
 * {@code temperature}, {@code maxTokens}); everything else is carried through to history untouched.
 */
public record IterationStep(StepKind kind, Map<String, Object> payload) {

    public IterationStep {
        Objects.requireNonNull(kind, "kind");
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static IterationStep of(StepKind kind) {
        return new IterationStep(kind, Map.of());
    }

    public static IterationStep of(StepKind kind, Map<String, Object> payload) {
        return new IterationStep(kind, payload);
    }
}
