package com.phillippitts.draftsmith.config.orchestration;

import com.phillippitts.draftsmith.config.properties.OrchestrationProperties;
import com.phillippitts.draftsmith.config.properties.StorageProperties;
import com.phillippitts.draftsmith.exception.UnknownBackendException;
import com.phillippitts.draftsmith.service.iteration.StepStateMachine;
import com.phillippitts.draftsmith.service.orchestration.GenerationOrchestrator;
import com.phillippitts.draftsmith.service.orchestration.GenerationOrchestratorBuilder;
import com.phillippitts.draftsmith.service.persona.InMemoryPersonaCatalog;
import com.phillippitts.draftsmith.service.provider.BackendKind;
import com.phillippitts.draftsmith.service.provider.ProviderHub;
import com.phillippitts.draftsmith.service.storage.FileSessionStorage;
import com.phillippitts.draftsmith.service.storage.SessionStorage;
import com.phillippitts.draftsmith.service.template.InMemoryTemplateCatalog;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the generation orchestrator and its collaborators.
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    public StepStateMachine stepStateMachine() {
        return new StepStateMachine();
    }

    @Bean
    public InMemoryTemplateCatalog templateCatalog() {
        return new InMemoryTemplateCatalog();
    }

    @Bean
    public InMemoryPersonaCatalog personaCatalog() {
        return new InMemoryPersonaCatalog();
    }

    /**
     * File-backed storage, active only when {@code storage.sessions-dir} is set.
     */
    @Bean
    @ConditionalOnProperty(prefix = "storage", name = "sessions-dir")
    public SessionStorage sessionStorage(StorageProperties storageProperties) {
        return new FileSessionStorage(Path.of(storageProperties.getSessionsDir()));
    }

    @Bean
    public GenerationOrchestrator generationOrchestrator(StepStateMachine stateMachine,
                                                         ProviderHub providerHub,
                                                         InMemoryTemplateCatalog templateCatalog,
                                                         InMemoryPersonaCatalog personaCatalog,
                                                         ObjectProvider<SessionStorage> sessionStorage,
                                                         ApplicationEventPublisher publisher,
                                                         OrchestrationProperties props) {
        BackendKind defaultBackend = BackendKind.fromKey(props.getDefaultBackend())
                .orElseThrow(() -> new UnknownBackendException(props.getDefaultBackend()));
        return GenerationOrchestratorBuilder.builder()
                .stateMachine(stateMachine)
                .providerHub(providerHub)
                .templateCatalog(templateCatalog)
                .personaCatalog(personaCatalog)
                .sessionStorage(sessionStorage.getIfAvailable())
                .publisher(publisher)
                .defaultBackend(defaultBackend)
                .clock(Clock.systemUTC())
                .build();
    }
}
