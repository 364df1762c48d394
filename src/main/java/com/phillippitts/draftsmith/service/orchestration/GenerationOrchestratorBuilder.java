package com.phillippitts.draftsmith.service.orchestration;

import com.phillippitts.draftsmith.service.iteration.StepStateMachine;
import com.phillippitts.draftsmith.service.persona.PersonaCatalog;
import com.phillippitts.draftsmith.service.provider.BackendKind;
import com.phillippitts.draftsmith.service.provider.ProviderHub;
import com.phillippitts.draftsmith.service.storage.SessionStorage;
import com.phillippitts.draftsmith.service.template.TemplateCatalog;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;

/**
 * Builder for {@link DefaultGenerationOrchestrator}.
 *
 * <p>Every collaborator is optional. Missing ones fall back to: a new {@link StepStateMachine},
 * no hub (steps recorded as skipped), no catalogs, no storage, a no-op event publisher,
 * {@link BackendKind#OPENAI} and the system UTC clock.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * GenerationOrchestrator orchestrator = GenerationOrchestratorBuilder.builder()
 *     .providerHub(hub)
 *     .templateCatalog(templates)
 *     .personaCatalog(personas)
 *     .sessionStorage(storage)
 *     .publisher(publisher)
 *     .defaultBackend(BackendKind.GEMINI_API)
 *     .build();
 * }</pre>
 *
 * @since 1.0
 */
public final class GenerationOrchestratorBuilder {

    private StepStateMachine stateMachine;
    private ProviderHub providerHub;
    private TemplateCatalog templateCatalog;
    private PersonaCatalog personaCatalog;
    private SessionStorage sessionStorage;
    private ApplicationEventPublisher publisher;
    private BackendKind defaultBackend;
    private Clock clock;

    private GenerationOrchestratorBuilder() {
        // use builder()
    }

    public static GenerationOrchestratorBuilder builder() {
        return new GenerationOrchestratorBuilder();
    }

    public GenerationOrchestratorBuilder stateMachine(StepStateMachine stateMachine) {
        this.stateMachine = stateMachine;
        return this;
    }

    /**
     * Sets the provider hub used for generating steps.
     *
     * @param providerHub hub, or null to record every step as skipped
     * @return this builder
     */
    public GenerationOrchestratorBuilder providerHub(ProviderHub providerHub) {
        this.providerHub = providerHub;
        return this;
    }

    public GenerationOrchestratorBuilder templateCatalog(TemplateCatalog templateCatalog) {
        this.templateCatalog = templateCatalog;
        return this;
    }

    public GenerationOrchestratorBuilder personaCatalog(PersonaCatalog personaCatalog) {
        this.personaCatalog = personaCatalog;
        return this;
    }

    /**
     * Sets the storage that receives a snapshot after every mutation.
     *
     * @param sessionStorage storage, or null to keep sessions in memory only
     * @return this builder
     */
    public GenerationOrchestratorBuilder sessionStorage(SessionStorage sessionStorage) {
        this.sessionStorage = sessionStorage;
        return this;
    }

    public GenerationOrchestratorBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    public GenerationOrchestratorBuilder defaultBackend(BackendKind defaultBackend) {
        this.defaultBackend = defaultBackend;
        return this;
    }

    public GenerationOrchestratorBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * Builds the orchestrator, filling in defaults for unset collaborators.
     *
     * @return configured orchestrator
     */
    public DefaultGenerationOrchestrator build() {
        return new DefaultGenerationOrchestrator(
                stateMachine != null ? stateMachine : new StepStateMachine(),
                providerHub,
                templateCatalog,
                personaCatalog,
                sessionStorage,
                publisher != null ? publisher : event -> { },
                defaultBackend != null ? defaultBackend : BackendKind.OPENAI,
                clock != null ? clock : Clock.systemUTC()
        );
    }
}
