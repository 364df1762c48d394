package com.phillippitts.draftsmith.domain.iteration;

public enum IterationStatus {
    ACTIVE,
    COMPLETED
}
