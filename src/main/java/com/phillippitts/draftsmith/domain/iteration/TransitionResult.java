package com.phillippitts.draftsmith.domain.iteration;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of feeding a step to the state machine. When {@code violations} is non-empty,
 * {@code state} is the unchanged input instance.
 */
public record TransitionResult(IterationState state,
                               StepKind nextRequiredStep,
                               List<IterationViolation> violations) {

    public TransitionResult {
        Objects.requireNonNull(state, "state");
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public boolean isAccepted() {
        return violations.isEmpty();
    }
}
