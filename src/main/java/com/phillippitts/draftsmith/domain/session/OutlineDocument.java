package com.phillippitts.draftsmith.domain.session;

import java.util.List;

/** Outline produced by an outline session; starts as an empty shell. */
public record OutlineDocument(String id, List<OutlineSection> sections, DocumentMetadata metadata) {

    public OutlineDocument {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }
}
