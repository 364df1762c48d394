package com.phillippitts.draftsmith.service.provider;

import java.util.stream.Collectors;

/**
 * Renders the prompt sent to a backend.
 *
 * <p>Layout, outermost marker first:
 * <pre>
 * [Mode: critique]
 * [Template: tpl-1]
 * [Persona: p-1]
 * raw prompt
 *
 * [Template Points]
 * - intro (priority 1): Open with the problem
 * </pre>
 * Markers whose value is absent or blank are omitted; the mode marker is always present.
 */
public final class ProviderPromptComposer {

    private ProviderPromptComposer() {
    }

    public static String compose(ProviderPayload payload, TemplateContext context) {
        String prompt = payload.prompt();
        if (context != null) {
            if (hasText(context.personaId())) {
                prompt = "[Persona: " + context.personaId() + "]\n" + prompt;
            }
            if (hasText(context.templateId())) {
                prompt = "[Template: " + context.templateId() + "]\n" + prompt;
            }
            if (!context.points().isEmpty()) {
                String points = context.points().stream()
                        .map(p -> "- " + p.pointId() + " (priority " + p.priority() + "): " + p.instructions())
                        .collect(Collectors.joining("\n"));
                prompt = prompt + "\n\n[Template Points]\n" + points;
            }
        }
        return "[Mode: " + payload.mode().wireName() + "]\n" + prompt;
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
