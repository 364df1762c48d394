package com.phillippitts.draftsmith.service.orchestration;

import com.phillippitts.draftsmith.domain.iteration.IterationMode;
import com.phillippitts.draftsmith.domain.iteration.IterationStep;
import com.phillippitts.draftsmith.domain.iteration.StepKind;
import com.phillippitts.draftsmith.domain.session.Session;
import com.phillippitts.draftsmith.domain.session.StepOutput;
import com.phillippitts.draftsmith.domain.session.StepRecord;
import com.phillippitts.draftsmith.service.iteration.StepStateMachine;
import com.phillippitts.draftsmith.service.persona.PersonaProfile;
import com.phillippitts.draftsmith.service.provider.ProviderMode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StepPromptBuilderTest {

    private final StepStateMachine machine = new StepStateMachine();

    private Session draftSession() {
        return Session.start("session-1", IterationMode.DRAFT, null, null, "outline-9", 0,
                machine.initialize(IterationMode.DRAFT), Instant.EPOCH);
    }

    @Test
    void explicitPromptWins() {
        String prompt = StepPromptBuilder.build(draftSession(),
                IterationStep.of(StepKind.GENERATE, Map.of("prompt", "Just this")), null);

        assertThat(prompt).isEqualTo("Just this");
    }

    @Test
    void generatePromptNamesSubjectAndPersona() {
        PersonaProfile persona = new PersonaProfile("p", "Mentor", "warm", "new hires");

        String prompt = StepPromptBuilder.build(draftSession(), IterationStep.of(StepKind.GENERATE), persona);

        assertThat(prompt).startsWith("Write a complete draft");
        assertThat(prompt).contains("\n\nOutline: outline-9\nTone: warm\nAudience: new hires");
        assertThat(prompt).doesNotContain("Previous output");
    }

    @Test
    void critiqueAppendsLatestGeneratedContent() {
        Session session = draftSession();
        IterationStep generate = IterationStep.of(StepKind.GENERATE);
        session = session.withStep(new StepRecord("step-1", session.id(), StepKind.GENERATE, Map.of(),
                        new StepOutput.Generated("Draft body", 1, 1, 2, "stop", "m"), Instant.EPOCH, 1),
                machine.handleStep(session.state(), generate).state(), Instant.EPOCH);

        String prompt = StepPromptBuilder.build(session, IterationStep.of(StepKind.CRITIQUE), null);

        assertThat(prompt).startsWith("Critique the previous output.");
        assertThat(prompt).endsWith("\n\nPrevious output:\nDraft body");
    }

    @Test
    void providerModeFollowsSessionModeForGenerate() {
        assertThat(StepPromptBuilder.providerMode(IterationMode.OUTLINE, StepKind.GENERATE))
                .isEqualTo(ProviderMode.OUTLINE);
        assertThat(StepPromptBuilder.providerMode(IterationMode.DRAFT, StepKind.GENERATE))
                .isEqualTo(ProviderMode.DRAFT);
        assertThat(StepPromptBuilder.providerMode(IterationMode.DRAFT, StepKind.QUESTION))
                .isEqualTo(ProviderMode.QUESTION);
        assertThatThrownBy(() -> StepPromptBuilder.providerMode(IterationMode.DRAFT, StepKind.APPROVAL))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
