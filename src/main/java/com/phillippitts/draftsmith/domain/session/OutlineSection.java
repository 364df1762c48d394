package com.phillippitts.draftsmith.domain.session;

import java.util.List;

public record OutlineSection(String id, String title, int level, List<OutlineSection> subsections) {

    public OutlineSection {
        subsections = subsections == null ? List.of() : List.copyOf(subsections);
    }
}
