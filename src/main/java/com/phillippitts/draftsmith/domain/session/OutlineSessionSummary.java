package com.phillippitts.draftsmith.domain.session;

import java.util.List;

public record OutlineSessionSummary(String sessionId, OutlineDocument outline, List<StepRecord> auditTrail) {

    public OutlineSessionSummary {
        auditTrail = auditTrail == null ? List.of() : List.copyOf(auditTrail);
    }
}
