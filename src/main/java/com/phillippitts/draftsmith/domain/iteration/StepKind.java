package com.phillippitts.draftsmith.domain.iteration;

import java.util.Arrays;
import java.util.Optional;

/** Steps a caller can submit to an iteration. */
public enum StepKind {
    GENERATE("generate"),
    CRITIQUE("critique"),
    REFLECTION("reflection"),
    QUESTION("question"),
    REGENERATE("regenerate"),
    APPROVAL("approval");

    private final String wireName;

    StepKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<StepKind> fromWireName(String name) {
        return Arrays.stream(values())
                .filter(k -> k.wireName.equals(name))
                .findFirst();
    }
}
