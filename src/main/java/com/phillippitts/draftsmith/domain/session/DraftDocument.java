package com.phillippitts.draftsmith.domain.session;

import java.util.List;

/** Draft produced by a draft session; starts empty and unapproved. */
public record DraftDocument(String id, String outlineId, String content, List<DraftSection> sections,
                            DocumentMetadata metadata) {

    public DraftDocument {
        content = content == null ? "" : content;
        sections = sections == null ? List.of() : List.copyOf(sections);
    }
}
