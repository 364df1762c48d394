package com.phillippitts.draftsmith.service.orchestration;

public enum OrchestrationFaultCode {
    VALIDATION_ERROR("validation_error"),
    INVALID_STATE("invalid_state");

    private final String wireName;

    OrchestrationFaultCode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
