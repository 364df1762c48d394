package com.phillippitts.draftsmith.domain.session;

/**
 * Input for {@code startOutlineCycle}.
 *
 * @param idea seed idea, must not be blank
 * @param personaId optional persona reference
 * @param templateId optional template reference
 * @param historyDepth how many earlier documents the caller wants considered, must be non-negative
 */
public record OutlineCycleInput(String idea, String personaId, String templateId, int historyDepth) {

    public static OutlineCycleInput of(String idea) {
        return new OutlineCycleInput(idea, null, null, 0);
    }
}
