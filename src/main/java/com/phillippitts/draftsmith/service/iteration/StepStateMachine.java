package com.phillippitts.draftsmith.service.iteration;

import com.phillippitts.draftsmith.domain.iteration.IterationHistoryEntry;
import com.phillippitts.draftsmith.domain.iteration.IterationMode;
import com.phillippitts.draftsmith.domain.iteration.IterationState;
import com.phillippitts.draftsmith.domain.iteration.IterationStatus;
import com.phillippitts.draftsmith.domain.iteration.IterationStep;
import com.phillippitts.draftsmith.domain.iteration.IterationViolation;
import com.phillippitts.draftsmith.domain.iteration.StepKind;
import com.phillippitts.draftsmith.domain.iteration.TransitionResult;
import com.phillippitts.draftsmith.domain.iteration.ViolationCode;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pure state machine that decides which step an iteration accepts next.
 *
 * <p><b>Step order:</b>
 * <pre>
 * outline: generate → critique → reflection → question → regenerate → (critique ...)
 * draft:   generate → critique → reflection → regenerate → (critique ...)
 * </pre>
 * After the last step of the order the sequence wraps to {@code critique}. {@code approval} is
 * accepted at any point where {@link IterationState#canApprove()} is true, i.e. directly after a
 * regenerate, and completes the iteration.
 *
 * <p><b>Immutability:</b> states are never mutated. A rejected step returns the very same state
 * instance together with a single violation; an accepted step returns a new state.
 *
 * <p><b>Thread Safety:</b> stateless, safe to share.
 *
 * @since 1.0
 */
public final class StepStateMachine {

    private static final Map<IterationMode, List<StepKind>> ORDER = new EnumMap<>(IterationMode.class);

    static {
        ORDER.put(IterationMode.OUTLINE, List.of(
                StepKind.GENERATE, StepKind.CRITIQUE, StepKind.REFLECTION, StepKind.QUESTION, StepKind.REGENERATE));
        ORDER.put(IterationMode.DRAFT, List.of(
                StepKind.GENERATE, StepKind.CRITIQUE, StepKind.REFLECTION, StepKind.REGENERATE));
    }

    /**
     * Creates the initial state for a mode: cycle 1, empty history, expecting {@code generate}.
     *
     * @param mode iteration mode
     * @return fresh active state
     * @throws NullPointerException if mode is null
     */
    public IterationState initialize(IterationMode mode) {
        Objects.requireNonNull(mode, "mode");
        return new IterationState(mode, IterationStatus.ACTIVE, 1, List.of(), StepKind.GENERATE, false);
    }

    /**
     * Applies a step to a state.
     *
     * <p>Checks run in this order: completed iteration, approval gate, expected step.
     *
     * @param state current state (never modified)
     * @param step submitted step
     * @return transition with the next state, the step now required (null once completed) and
     *         any violations
     */
    public TransitionResult handleStep(IterationState state, IterationStep step) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(step, "step");

        if (state.isCompleted()) {
            return reject(state, ViolationCode.ALREADY_COMPLETED,
                    "Iteration already completed; no further steps are accepted", Map.of());
        }

        if (step.kind() == StepKind.APPROVAL) {
            if (!state.canApprove()) {
                return reject(state, ViolationCode.APPROVAL_NOT_ALLOWED,
                        "Approval is only allowed directly after a regenerate step",
                        Map.of("expected", state.nextRequiredStep().wireName()));
            }
            return approve(state, step);
        }

        if (step.kind() != state.nextRequiredStep()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("expected", state.nextRequiredStep().wireName());
            details.put("received", step.kind().wireName());
            return reject(state, ViolationCode.UNEXPECTED_STEP,
                    "Expected step '" + state.nextRequiredStep().wireName()
                            + "' but received '" + step.kind().wireName() + "'", details);
        }

        int cycle = step.kind() == StepKind.REGENERATE ? state.cycle() + 1 : state.cycle();
        List<IterationHistoryEntry> history = append(state, cycle, step);
        StepKind next = nextAfter(state.mode(), step.kind());
        IterationState updated = new IterationState(state.mode(), IterationStatus.ACTIVE, cycle, history, next,
                step.kind() == StepKind.REGENERATE);
        return new TransitionResult(updated, next, List.of());
    }

    /**
     * Returns the ordered steps of a mode.
     */
    public List<StepKind> stepOrder(IterationMode mode) {
        return ORDER.get(Objects.requireNonNull(mode, "mode"));
    }

    private TransitionResult approve(IterationState state, IterationStep step) {
        // Approval is attributed to the cycle the regenerate closed
        int approvalCycle = Math.max(1, state.cycle() - 1);
        List<IterationHistoryEntry> history = append(state, approvalCycle, step);
        IterationState completed = new IterationState(state.mode(), IterationStatus.COMPLETED, state.cycle(),
                history, null, false);
        return new TransitionResult(completed, null, List.of());
    }

    private static List<IterationHistoryEntry> append(IterationState state, int cycle, IterationStep step) {
        List<IterationHistoryEntry> history = new ArrayList<>(state.history().size() + 1);
        history.addAll(state.history());
        history.add(new IterationHistoryEntry(state.history().size() + 1, cycle, step.kind(), step.payload()));
        return history;
    }

    private StepKind nextAfter(IterationMode mode, StepKind current) {
        List<StepKind> order = ORDER.get(mode);
        int index = order.indexOf(current);
        if (index < 0 || index == order.size() - 1) {
            return StepKind.CRITIQUE;
        }
        return order.get(index + 1);
    }

    private static TransitionResult reject(IterationState state, ViolationCode code, String message,
                                           Map<String, Object> details) {
        IterationViolation violation = new IterationViolation(code, message, details);
        return new TransitionResult(state, state.nextRequiredStep(), List.of(violation));
    }
}
