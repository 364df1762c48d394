package com.phillippitts.draftsmith.domain.iteration;

/** Kind of document an iteration produces. */
public enum IterationMode {
    OUTLINE("outline"),
    DRAFT("draft");

    private final String wireName;

    IterationMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
