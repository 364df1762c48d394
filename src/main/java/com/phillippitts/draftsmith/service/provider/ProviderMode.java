package com.phillippitts.draftsmith.service.provider;

/** Purpose of a generation request; rendered into the prompt as {@code [Mode: ...]}. */
public enum ProviderMode {
    OUTLINE("outline"),
    DRAFT("draft"),
    CRITIQUE("critique"),
    REFLECTION("reflection"),
    QUESTION("question");

    private final String wireName;

    ProviderMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
