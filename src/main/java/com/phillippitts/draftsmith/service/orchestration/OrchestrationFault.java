package com.phillippitts.draftsmith.service.orchestration;

import com.phillippitts.draftsmith.domain.iteration.IterationViolation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Orchestrator-level fault. Validation and unknown-session faults are non-recoverable;
 * rejected steps are recoverable (the caller can resubmit the expected step).
 */
public record OrchestrationFault(OrchestrationFaultCode code,
                                 String message,
                                 boolean recoverable,
                                 Map<String, Object> details) {

    public OrchestrationFault {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static OrchestrationFault validation(String message) {
        return new OrchestrationFault(OrchestrationFaultCode.VALIDATION_ERROR, message, false, Map.of());
    }

    public static OrchestrationFault sessionNotFound(String sessionId) {
        return new OrchestrationFault(OrchestrationFaultCode.INVALID_STATE,
                "Session " + sessionId + " not found", false, Map.of());
    }

    /** Rejected step; carries the violation code under {@code violation} plus its details. */
    public static OrchestrationFault rejectedStep(IterationViolation violation) {
        Map<String, Object> details = new LinkedHashMap<>(violation.details());
        details.put("violation", violation.code().wireName());
        return new OrchestrationFault(OrchestrationFaultCode.INVALID_STATE, violation.message(), true, details);
    }
}
