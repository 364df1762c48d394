package com.phillippitts.draftsmith.service.orchestration;

import com.phillippitts.draftsmith.domain.CollaboratorFault;
import com.phillippitts.draftsmith.domain.Result;
import com.phillippitts.draftsmith.domain.iteration.IterationMode;
import com.phillippitts.draftsmith.domain.iteration.IterationStep;
import com.phillippitts.draftsmith.domain.iteration.IterationViolation;
import com.phillippitts.draftsmith.domain.iteration.StepKind;
import com.phillippitts.draftsmith.domain.iteration.TransitionResult;
import com.phillippitts.draftsmith.domain.session.DocumentMetadata;
import com.phillippitts.draftsmith.domain.session.DraftCycleInput;
import com.phillippitts.draftsmith.domain.session.DraftDocument;
import com.phillippitts.draftsmith.domain.session.DraftSessionSummary;
import com.phillippitts.draftsmith.domain.session.OutlineCycleInput;
import com.phillippitts.draftsmith.domain.session.OutlineDocument;
import com.phillippitts.draftsmith.domain.session.OutlineSessionSummary;
import com.phillippitts.draftsmith.domain.session.PointEvaluation;
import com.phillippitts.draftsmith.domain.session.PointOverride;
import com.phillippitts.draftsmith.domain.session.Session;
import com.phillippitts.draftsmith.domain.session.StepOutput;
import com.phillippitts.draftsmith.domain.session.StepRecord;
import com.phillippitts.draftsmith.service.iteration.StepStateMachine;
import com.phillippitts.draftsmith.service.orchestration.event.SessionPersistenceFailedEvent;
import com.phillippitts.draftsmith.service.persona.PersonaCatalog;
import com.phillippitts.draftsmith.service.persona.PersonaProfile;
import com.phillippitts.draftsmith.service.provider.BackendKind;
import com.phillippitts.draftsmith.service.provider.FallbackAttempt;
import com.phillippitts.draftsmith.service.provider.PointContext;
import com.phillippitts.draftsmith.service.provider.ProviderFault;
import com.phillippitts.draftsmith.service.provider.ProviderHub;
import com.phillippitts.draftsmith.service.provider.ProviderPayload;
import com.phillippitts.draftsmith.service.provider.ProviderRequest;
import com.phillippitts.draftsmith.service.provider.ProviderResponse;
import com.phillippitts.draftsmith.service.provider.TemplateContext;
import com.phillippitts.draftsmith.service.provider.TokenUsage;
import com.phillippitts.draftsmith.service.storage.SessionStorage;
import com.phillippitts.draftsmith.service.template.TemplateCatalog;
import com.phillippitts.draftsmith.service.template.TemplateDescriptor;
import com.phillippitts.draftsmith.service.template.TemplatePoint;
import com.phillippitts.draftsmith.util.LogSanitizer;
import com.phillippitts.draftsmith.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default {@link GenerationOrchestrator}: in-memory session store, per-session locking, and
 * optional collaborators (provider hub, template and persona catalogs, session storage).
 *
 * <p>Construct via {@link GenerationOrchestratorBuilder}. Every collaborator except the state
 * machine may be absent: without a hub, steps are recorded with a skipped output; without
 * storage, snapshots stay in memory only.
 *
 * <p><b>Logging:</b> {@code sessionId} is placed in the Log4j2 {@link ThreadContext} while a step
 * is processed, so hub and adapter log lines carry it.
 *
 * @see GenerationOrchestratorBuilder
 * @since 1.0
 */
public final class DefaultGenerationOrchestrator implements GenerationOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultGenerationOrchestrator.class);

    static final String MDC_SESSION_ID = "sessionId";
    static final String PAYLOAD_PROVIDER = "provider";
    static final String PAYLOAD_TEMPERATURE = "temperature";
    static final String PAYLOAD_MAX_TOKENS = "maxTokens";
    private static final int EVIDENCE_CHARS = 200;

    private static final Set<StepKind> GENERATING_STEPS =
            EnumSet.of(StepKind.GENERATE, StepKind.CRITIQUE, StepKind.REFLECTION, StepKind.QUESTION);

    private final StepStateMachine stateMachine;
    private final ProviderHub hub;
    private final TemplateCatalog templates;
    private final PersonaCatalog personas;
    private final SessionStorage storage;
    private final ApplicationEventPublisher publisher;
    private final BackendKind defaultBackend;
    private final Clock clock;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> sessionLocks = new ConcurrentHashMap<>();

    /**
     * @param stateMachine step state machine (required)
     * @param hub provider hub, nullable
     * @param templates template catalog, nullable
     * @param personas persona catalog, nullable
     * @param storage session storage, nullable
     * @param publisher event publisher (required)
     * @param defaultBackend backend used unless a step payload names another (required)
     * @param clock clock for timestamps (required)
     */
    public DefaultGenerationOrchestrator(StepStateMachine stateMachine,
                                         ProviderHub hub,
                                         TemplateCatalog templates,
                                         PersonaCatalog personas,
                                         SessionStorage storage,
                                         ApplicationEventPublisher publisher,
                                         BackendKind defaultBackend,
                                         Clock clock) {
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.hub = hub;
        this.templates = templates;
        this.personas = personas;
        this.storage = storage;
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.defaultBackend = Objects.requireNonNull(defaultBackend, "defaultBackend");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Result<OutlineSessionSummary, OrchestrationFault> startOutlineCycle(OutlineCycleInput input) {
        Objects.requireNonNull(input, "input");
        if (isBlank(input.idea())) {
            return Result.err(OrchestrationFault.validation("Idea is required and cannot be empty"));
        }
        if (input.historyDepth() < 0) {
            return Result.err(OrchestrationFault.validation("History depth must be non-negative"));
        }

        Instant now = clock.instant();
        Session session = Session.start(newId("session-"), IterationMode.OUTLINE, input.personaId(),
                input.templateId(), input.idea(), input.historyDepth(),
                stateMachine.initialize(IterationMode.OUTLINE), now);
        register(session);
        LOG.info("Started outline session {} (persona={}, template={}, historyDepth={})",
                session.id(), input.personaId(), input.templateId(), input.historyDepth());

        OutlineDocument outline = new OutlineDocument(newId("doc-"), List.of(), DocumentMetadata.initial(now));
        return Result.ok(new OutlineSessionSummary(session.id(), outline, List.of()));
    }

    @Override
    public Result<DraftSessionSummary, OrchestrationFault> startDraftCycle(DraftCycleInput input) {
        Objects.requireNonNull(input, "input");
        if (isBlank(input.outlineId())) {
            return Result.err(OrchestrationFault.validation("Outline ID is required and cannot be empty"));
        }

        Instant now = clock.instant();
        Session session = Session.start(newId("session-"), IterationMode.DRAFT, input.personaId(),
                input.templateId(), input.outlineId(), 0,
                stateMachine.initialize(IterationMode.DRAFT), now);
        register(session);
        LOG.info("Started draft session {} (outline={}, persona={}, template={})",
                session.id(), input.outlineId(), input.personaId(), input.templateId());

        DraftDocument draft = new DraftDocument(newId("doc-"), input.outlineId(), "", List.of(),
                DocumentMetadata.initial(now));
        return Result.ok(new DraftSessionSummary(session.id(), draft, List.of()));
    }

    @Override
    public Result<Session, OrchestrationFault> resumeSession(String sessionId, IterationStep step) {
        Objects.requireNonNull(step, "step");
        if (sessionId == null || !sessions.containsKey(sessionId)) {
            return Result.err(OrchestrationFault.sessionNotFound(sessionId));
        }

        ReentrantLock lock = sessionLocks.computeIfAbsent(sessionId, id -> new ReentrantLock());
        lock.lock();
        ThreadContext.put(MDC_SESSION_ID, sessionId);
        try {
            Session session = sessions.get(sessionId);
            TransitionResult transition = stateMachine.handleStep(session.state(), step);
            if (!transition.isAccepted()) {
                IterationViolation violation = transition.violations().get(0);
                LOG.info("Rejected step {} for session {}: {}", step.kind().wireName(), sessionId,
                        violation.code().wireName());
                return Result.err(OrchestrationFault.rejectedStep(violation));
            }

            long start = System.nanoTime();
            StepOutput output = produceOutput(session, step);
            StepRecord record = new StepRecord(newId("step-"), sessionId, step.kind(), step.payload(), output,
                    clock.instant(), TimeUtils.elapsedMillis(start));

            Session updated = session.withStep(record, transition.state(), clock.instant());
            sessions.put(sessionId, updated);
            LOG.info("Session {} accepted {} (cycle={}, next={}, output={}, durationMs={})",
                    sessionId, step.kind().wireName(), updated.state().cycle(),
                    updated.state().isCompleted() ? "completed" : updated.state().nextRequiredStep().wireName(),
                    output.type(), record.durationMs());

            persist(updated);
            return Result.ok(updated);
        } finally {
            ThreadContext.remove(MDC_SESSION_ID);
            lock.unlock();
        }
    }

    @Override
    public Result<Session, OrchestrationFault> getSession(String sessionId) {
        Session session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            return Result.err(OrchestrationFault.sessionNotFound(sessionId));
        }
        return Result.ok(session);
    }

    @Override
    public Result<PointEvaluation, OrchestrationFault> applyTemplatePoint(String sessionId, String pointId,
                                                                          PointOverride override) {
        Session session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            return Result.err(OrchestrationFault.sessionNotFound(sessionId));
        }
        if (isBlank(pointId)) {
            return Result.err(OrchestrationFault.validation("Point ID is required and cannot be empty"));
        }

        PointOverride effective = override != null ? override : PointOverride.NONE;
        Optional<TemplatePoint> templatePoint = loadTemplate(session).flatMap(t -> t.point(pointId));
        String instructions = effective.instructions() != null
                ? effective.instructions()
                : templatePoint.map(TemplatePoint::instructions).orElse(null);
        Integer priority = effective.priority() != null
                ? effective.priority()
                : templatePoint.map(TemplatePoint::priority).orElse(null);

        StringBuilder notes = new StringBuilder("Point ").append(pointId).append(" recorded without automated review");
        if (instructions != null && !instructions.isBlank()) {
            notes.append("; instructions: ").append(instructions);
        }
        if (priority != null) {
            notes.append("; priority: ").append(priority);
        }
        String evidence = session.latestGenerated()
                .map(g -> LogSanitizer.truncate(g.content(), EVIDENCE_CHARS))
                .orElse("");

        LOG.debug("Applied template point {} to session {} (override={})", pointId, sessionId, override != null);
        return Result.ok(new PointEvaluation(pointId, true, notes.toString(), evidence));
    }

    private void register(Session session) {
        sessions.put(session.id(), session);
        sessionLocks.put(session.id(), new ReentrantLock());
        persist(session);
    }

    private StepOutput produceOutput(Session session, IterationStep step) {
        if (!GENERATING_STEPS.contains(step.kind())) {
            return new StepOutput.Skipped(step.kind().wireName() + " does not call a provider");
        }
        if (hub == null) {
            return new StepOutput.Skipped("no provider hub configured");
        }

        ProviderRequest request = buildRequest(session, step);
        Result<ProviderResponse, ProviderFault> result = hub.executeWithFallback(request);
        if (result.isOk()) {
            ProviderResponse response = result.getValue();
            TokenUsage usage = response.usage();
            LOG.debug("Step {} generated {} chars: '{}'", step.kind().wireName(), response.content().length(),
                    LogSanitizer.preview(response.content()));
            return new StepOutput.Generated(response.content(),
                    usage == null ? 0 : usage.promptTokens(),
                    usage == null ? 0 : usage.completionTokens(),
                    usage == null ? 0 : usage.totalTokens(),
                    response.finishReason(), response.model());
        }

        ProviderFault fault = result.getError();
        LOG.warn("Step {} recorded provider failure: code={}, provider={}", step.kind().wireName(),
                fault.code().wireName(), fault.provider() == null ? "-" : fault.provider().key());
        return new StepOutput.Failed(fault.code().wireName(), fault.message(), fault.recoverable(),
                failureDetails(fault));
    }

    ProviderRequest buildRequest(Session session, IterationStep step) {
        PersonaProfile persona = loadPersona(session).orElse(null);
        List<PointContext> points = new ArrayList<>();
        loadTemplate(session).ifPresent(t -> {
            for (TemplatePoint p : t.points()) {
                points.add(new PointContext(p.id(), p.instructions(), p.priority()));
            }
        });

        TemplateContext context = new TemplateContext(session.templateId(), session.personaId(), points);
        ProviderPayload payload = new ProviderPayload(
                StepPromptBuilder.build(session, step, persona),
                StepPromptBuilder.providerMode(session.mode(), step.kind()),
                intOption(step.payload().get(PAYLOAD_MAX_TOKENS)),
                doubleOption(step.payload().get(PAYLOAD_TEMPERATURE)));
        return new ProviderRequest(backendFor(step), payload, context.isEmpty() ? null : context);
    }

    private BackendKind backendFor(IterationStep step) {
        Object requested = step.payload().get(PAYLOAD_PROVIDER);
        if (requested instanceof String key) {
            Optional<BackendKind> kind = BackendKind.fromKey(key);
            if (kind.isPresent()) {
                return kind.get();
            }
            LOG.warn("Ignoring unknown provider '{}' in step payload; using {}", key, defaultBackend.key());
        }
        return defaultBackend;
    }

    private Optional<PersonaProfile> loadPersona(Session session) {
        if (session.personaId() == null || personas == null) {
            return Optional.empty();
        }
        Result<PersonaProfile, CollaboratorFault> result = personas.getPersona(session.personaId());
        if (result.isErr()) {
            LOG.warn("Persona {} unavailable for session {}: {}", session.personaId(), session.id(),
                    result.getError().message());
            return Optional.empty();
        }
        return Optional.of(result.getValue());
    }

    private Optional<TemplateDescriptor> loadTemplate(Session session) {
        if (session.templateId() == null || templates == null) {
            return Optional.empty();
        }
        Result<TemplateDescriptor, CollaboratorFault> result = templates.loadTemplate(session.templateId());
        if (result.isErr()) {
            LOG.warn("Template {} unavailable for session {}: {}", session.templateId(), session.id(),
                    result.getError().message());
            return Optional.empty();
        }
        return Optional.of(result.getValue());
    }

    private void persist(Session session) {
        if (storage == null) {
            return;
        }
        CollaboratorFault fault;
        try {
            Result<String, CollaboratorFault> saved = storage.saveSession(session);
            if (saved.isOk()) {
                LOG.debug("Persisted session {} to {}", session.id(), saved.getValue());
                return;
            }
            fault = saved.getError();
        } catch (RuntimeException e) {
            fault = CollaboratorFault.of("storage_error", e.toString());
        }
        LOG.warn("Failed to persist session {}: code={}, message={}", session.id(), fault.code(), fault.message());
        publisher.publishEvent(new SessionPersistenceFailedEvent(session.id(), fault.code(), fault.message(),
                clock.instant()));
    }

    /**
     * Flattens fault details into plain values so they can be stored and serialized.
     */
    private static Map<String, Object> failureDetails(ProviderFault fault) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (fault.provider() != null) {
            details.put("provider", fault.provider().key());
        }
        for (Map.Entry<String, Object> entry : fault.details().entrySet()) {
            if (ProviderFault.DETAIL_ALL_ERRORS.equals(entry.getKey()) && entry.getValue() instanceof List<?> list) {
                List<Map<String, Object>> attempts = new ArrayList<>();
                for (Object item : list) {
                    if (item instanceof FallbackAttempt attempt) {
                        Map<String, Object> a = new LinkedHashMap<>();
                        a.put("provider", attempt.provider().key());
                        a.put("code", attempt.fault().code().wireName());
                        a.put("message", attempt.fault().message());
                        attempts.add(a);
                    }
                }
                details.put(entry.getKey(), attempts);
            } else {
                details.put(entry.getKey(), entry.getValue());
            }
        }
        return details;
    }

    private static Integer intOption(Object value) {
        return value instanceof Number n ? Integer.valueOf(n.intValue()) : null;
    }

    private static Double doubleOption(Object value) {
        return value instanceof Number n ? Double.valueOf(n.doubleValue()) : null;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    private static String newId(String prefix) {
        return prefix + UUID.randomUUID();
    }
}
