package com.phillippitts.draftsmith;

import com.phillippitts.draftsmith.domain.Result;
import com.phillippitts.draftsmith.domain.iteration.IterationStep;
import com.phillippitts.draftsmith.domain.iteration.StepKind;
import com.phillippitts.draftsmith.domain.session.OutlineCycleInput;
import com.phillippitts.draftsmith.domain.session.Session;
import com.phillippitts.draftsmith.domain.session.StepOutput;
import com.phillippitts.draftsmith.service.orchestration.GenerationOrchestrator;
import com.phillippitts.draftsmith.service.orchestration.OrchestrationFault;
import com.phillippitts.draftsmith.service.provider.BackendKind;
import com.phillippitts.draftsmith.service.provider.ProviderHub;
import com.phillippitts.draftsmith.service.storage.SessionStorage;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    properties = {
        "provider.channels.openai.api-key=", // no network access in tests
        "provider.timeout-ms=2000"
    }
)
class DraftsmithApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private GenerationOrchestrator orchestrator;

    @Autowired
    private ProviderHub providerHub;

    @Test
    void contextLoads() {
        assertThat(context.getBeanNamesForType(SessionStorage.class)).isEmpty();
        assertThat(providerHub.registeredProviders()).containsExactly(BackendKind.OPENAI);
        assertThat(providerHub.isConfigured(BackendKind.OPENAI)).isFalse();
    }

    @Test
    void unconfiguredBackendIsRecordedAsFailedStep() {
        String id = orchestrator.startOutlineCycle(OutlineCycleInput.of("Release notes for 2.0"))
                .getValue().sessionId();

        Result<Session, OrchestrationFault> r = orchestrator.resumeSession(id, IterationStep.of(StepKind.GENERATE));

        assertThat(r.isOk()).isTrue();
        StepOutput output = r.getValue().steps().get(0).output();
        assertThat(output).isInstanceOf(StepOutput.Failed.class);
        assertThat(((StepOutput.Failed) output).code()).isEqualTo("provider_not_configured");
    }
}
