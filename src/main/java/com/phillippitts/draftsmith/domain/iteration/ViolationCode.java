package com.phillippitts.draftsmith.domain.iteration;

/** Reasons the state machine rejects a step. */
public enum ViolationCode {
    UNEXPECTED_STEP("unexpected-step"),
    APPROVAL_NOT_ALLOWED("approval-not-allowed"),
    ALREADY_COMPLETED("already-completed");

    private final String wireName;

    ViolationCode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
