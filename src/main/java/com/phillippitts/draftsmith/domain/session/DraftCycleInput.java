package com.phillippitts.draftsmith.domain.session;

/**
 * Input for {@code startDraftCycle}.
 *
 * @param outlineId outline the draft expands, must not be blank
 */
public record DraftCycleInput(String outlineId, String personaId, String templateId) {

    public static DraftCycleInput of(String outlineId) {
        return new DraftCycleInput(outlineId, null, null);
    }
}
