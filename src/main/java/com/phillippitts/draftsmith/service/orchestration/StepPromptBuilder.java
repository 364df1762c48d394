package com.phillippitts.draftsmith.service.orchestration;

import com.phillippitts.draftsmith.domain.iteration.IterationMode;
import com.phillippitts.draftsmith.domain.iteration.IterationStep;
import com.phillippitts.draftsmith.domain.iteration.StepKind;
import com.phillippitts.draftsmith.domain.session.Session;
import com.phillippitts.draftsmith.domain.session.StepOutput;
import com.phillippitts.draftsmith.service.persona.PersonaProfile;
import com.phillippitts.draftsmith.service.provider.ProviderMode;

/**
 * Builds the raw prompt for a generating step. Context markers ({@code [Mode: ...]},
 * {@code [Persona: ...]}, template points) are added later by the provider hub.
 *
 * <p>A non-blank {@code prompt} entry in the step payload is used verbatim. Otherwise the prompt
 * is a step instruction followed by the session subject, persona voice, and the most recent
 * generated text (except for {@code generate}, which starts from the subject alone).
 */
public final class StepPromptBuilder {

    public static final String PAYLOAD_PROMPT = "prompt";

    private StepPromptBuilder() {}

    public static String build(Session session, IterationStep step, PersonaProfile persona) {
        Object explicit = step.payload().get(PAYLOAD_PROMPT);
        if (explicit instanceof String s && !s.isBlank()) {
            return s;
        }

        var sb = new StringBuilder();
        sb.append(instruction(session.mode(), step.kind()));
        sb.append("\n\n");
        sb.append(session.mode() == IterationMode.OUTLINE ? "Idea: " : "Outline: ").append(session.subject());

        if (persona != null) {
            if (persona.tone() != null && !persona.tone().isBlank()) {
                sb.append("\nTone: ").append(persona.tone());
            }
            if (persona.audience() != null && !persona.audience().isBlank()) {
                sb.append("\nAudience: ").append(persona.audience());
            }
        }

        if (step.kind() != StepKind.GENERATE) {
            session.latestGenerated()
                    .map(StepOutput.Generated::content)
                    .filter(c -> !c.isBlank())
                    .ifPresent(c -> sb.append("\n\nPrevious output:\n").append(c));
        }
        return sb.toString();
    }

    /**
     * Request mode for a generating step; {@code generate} maps to the session's document type.
     *
     * @throws IllegalArgumentException for steps that never reach a backend
     */
    public static ProviderMode providerMode(IterationMode mode, StepKind kind) {
        switch (kind) {
            case GENERATE:
                return mode == IterationMode.OUTLINE ? ProviderMode.OUTLINE : ProviderMode.DRAFT;
            case CRITIQUE:
                return ProviderMode.CRITIQUE;
            case REFLECTION:
                return ProviderMode.REFLECTION;
            case QUESTION:
                return ProviderMode.QUESTION;
            default:
                throw new IllegalArgumentException("Step " + kind.wireName() + " has no provider mode");
        }
    }

    private static String instruction(IterationMode mode, StepKind kind) {
        switch (kind) {
            case GENERATE:
                return mode == IterationMode.OUTLINE
                        ? "Produce a structured, hierarchical outline for the idea below."
                        : "Write a complete draft that follows the outline below section by section.";
            case CRITIQUE:
                return "Critique the previous output. List concrete weaknesses, gaps and unclear passages.";
            case REFLECTION:
                return "Reflect on the critique of the previous output and decide which changes matter most.";
            case QUESTION:
                return "List the open questions the author should answer before the next revision.";
            default:
                throw new IllegalArgumentException("Step " + kind.wireName() + " has no prompt");
        }
    }
}
