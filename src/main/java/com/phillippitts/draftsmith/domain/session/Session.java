package com.phillippitts.draftsmith.domain.session;

import com.phillippitts.draftsmith.domain.iteration.IterationMode;
import com.phillippitts.draftsmith.domain.iteration.IterationState;
import com.phillippitts.draftsmith.domain.iteration.StepKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a generation session.
 *
 * <p>The orchestrator replaces the stored snapshot on every accepted step via
 * {@link #withStep(StepRecord, IterationState, Instant)}; earlier snapshots stay valid.
 *
 * @param subject the idea (outline mode) or outline id (draft mode)
 * @param historyDepth history depth requested for outline sessions, 0 for drafts
 * @param steps audit trail, oldest first
 * @param outputs latest output per step kind
 */
public record Session(String id,
                      IterationMode mode,
                      String personaId,
                      String templateId,
                      String subject,
                      int historyDepth,
                      List<StepRecord> steps,
                      Map<StepKind, StepOutput> outputs,
                      IterationState state,
                      Instant createdAt,
                      Instant updatedAt) {

    public Session {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(state, "state");
        steps = steps == null ? List.of() : List.copyOf(steps);
        outputs = outputs == null || outputs.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(outputs));
    }

    /** New session with no steps. */
    public static Session start(String id, IterationMode mode, String personaId, String templateId,
                                String subject, int historyDepth, IterationState state, Instant now) {
        return new Session(id, mode, personaId, templateId, subject, historyDepth,
                List.of(), Map.of(), state, now, now);
    }

    /**
     * Snapshot with one more step record, the step's output stored under its kind, and the new state.
     */
    public Session withStep(StepRecord record, IterationState newState, Instant now) {
        List<StepRecord> nextSteps = new ArrayList<>(steps.size() + 1);
        nextSteps.addAll(steps);
        nextSteps.add(record);
        Map<StepKind, StepOutput> nextOutputs = new EnumMap<>(StepKind.class);
        nextOutputs.putAll(outputs);
        nextOutputs.put(record.kind(), record.output());
        return new Session(id, mode, personaId, templateId, subject, historyDepth,
                nextSteps, nextOutputs, newState, createdAt, now);
    }

    /** Most recent generated output across all steps, if any. */
    public Optional<StepOutput.Generated> latestGenerated() {
        for (int i = steps.size() - 1; i >= 0; i--) {
            if (steps.get(i).output() instanceof StepOutput.Generated generated) {
                return Optional.of(generated);
            }
        }
        return Optional.empty();
    }
}
