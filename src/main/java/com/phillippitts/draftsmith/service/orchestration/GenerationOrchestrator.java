package com.phillippitts.draftsmith.service.orchestration;

import com.phillippitts.draftsmith.domain.Result;
import com.phillippitts.draftsmith.domain.iteration.IterationStep;
import com.phillippitts.draftsmith.domain.session.DraftCycleInput;
import com.phillippitts.draftsmith.domain.session.DraftSessionSummary;
import com.phillippitts.draftsmith.domain.session.OutlineCycleInput;
import com.phillippitts.draftsmith.domain.session.OutlineSessionSummary;
import com.phillippitts.draftsmith.domain.session.PointEvaluation;
import com.phillippitts.draftsmith.domain.session.PointOverride;
import com.phillippitts.draftsmith.domain.session.Session;

/**
 * Owns the lifecycle of generation sessions.
 *
 * <p>A session is created by one of the {@code start*Cycle} operations and advanced by
 * {@link #resumeSession(String, IterationStep)}, which feeds the step through the step state
 * machine, calls the provider hub for generating steps, records the step and persists the new
 * snapshot.
 *
 * <p><b>Session Lifecycle:</b>
 * <ol>
 *   <li>{@link #startOutlineCycle(OutlineCycleInput)} or {@link #startDraftCycle(DraftCycleInput)}</li>
 *   <li>{@code resumeSession} with generate, critique, reflection, (question,) regenerate ...</li>
 *   <li>{@code resumeSession} with approval directly after a regenerate</li>
 * </ol>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * Result<OutlineSessionSummary, OrchestrationFault> started =
 *         orchestrator.startOutlineCycle(OutlineCycleInput.of("A talk on cache invalidation"));
 * String id = started.getValue().sessionId();
 *
 * Result<Session, OrchestrationFault> r = orchestrator.resumeSession(id, IterationStep.of(StepKind.GENERATE));
 * if (r.isErr() && r.getError().recoverable()) {
 *     // wrong step; r.getError().details() names the expected one
 * }
 * }</pre>
 *
 * <p><b>Failure Model:</b> faults are returned, not thrown. Backend failures do not fail
 * {@code resumeSession}; they are recorded as the step's output. Storage failures are logged and
 * published as events.
 *
 * <p><b>Thread Safety:</b> implementations must be thread-safe. Calls for the same session are
 * serialized; different sessions proceed independently.
 *
 * @since 1.0
 */
public interface GenerationOrchestrator {

    /**
     * Starts an outline session.
     *
     * @param input idea (non-blank), optional persona/template, history depth (non-negative)
     * @return summary with an empty outline, or a non-recoverable {@code validation_error}
     */
    Result<OutlineSessionSummary, OrchestrationFault> startOutlineCycle(OutlineCycleInput input);

    /**
     * Starts a draft session.
     *
     * @param input outline id (non-blank), optional persona/template
     * @return summary with an empty, unapproved draft, or a non-recoverable {@code validation_error}
     */
    Result<DraftSessionSummary, OrchestrationFault> startDraftCycle(DraftCycleInput input);

    /**
     * Advances a session by one step.
     *
     * <p>Exactly one step record is appended per accepted call. A rejected step leaves the stored
     * session untouched and returns a recoverable {@code invalid_state} fault.
     *
     * @param sessionId session to advance
     * @param step step to apply
     * @return updated snapshot, or {@code invalid_state} (non-recoverable when the session is unknown)
     */
    Result<Session, OrchestrationFault> resumeSession(String sessionId, IterationStep step);

    /**
     * @return current snapshot, or non-recoverable {@code invalid_state} when unknown
     */
    Result<Session, OrchestrationFault> getSession(String sessionId);

    /**
     * Evaluates a template point against the session's latest output.
     *
     * <p>The evaluation is a placeholder: every point is reported compliant, the notes name the
     * effective instructions and priority (override first, then the session template), and the
     * evidence is an excerpt of the latest generated text.
     *
     * @param override optional replacement instructions/priority, may be null
     */
    Result<PointEvaluation, OrchestrationFault> applyTemplatePoint(String sessionId, String pointId,
                                                                   PointOverride override);
}
