package com.phillippitts.draftsmith.domain.iteration;

import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of an iteration.
 *
 * <p>{@code nextRequiredStep} is {@code null} once the iteration has completed; use
 * {@link #isCompleted()} rather than testing it directly.
 *
 * @param mode outline or draft
 * @param status active or completed
 * @param cycle current cycle, starting at 1 and incremented by each accepted regenerate
 * @param history accepted steps, oldest first
 * @param nextRequiredStep step the state machine expects next, or null when completed
 * @param canApprove true only directly after a regenerate
 */
public record IterationState(IterationMode mode,
                             IterationStatus status,
                             int cycle,
                             List<IterationHistoryEntry> history,
                             StepKind nextRequiredStep,
                             boolean canApprove) {

    public IterationState {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(status, "status");
        if (cycle < 1) {
            throw new IllegalArgumentException("cycle must be >= 1, got: " + cycle);
        }
        history = history == null ? List.of() : List.copyOf(history);
        if (status == IterationStatus.ACTIVE) {
            Objects.requireNonNull(nextRequiredStep, "nextRequiredStep is required while active");
        }
    }

    public boolean isCompleted() {
        return status == IterationStatus.COMPLETED;
    }
}
