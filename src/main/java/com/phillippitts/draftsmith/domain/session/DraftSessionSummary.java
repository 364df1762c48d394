package com.phillippitts.draftsmith.domain.session;

import java.util.List;

public record DraftSessionSummary(String sessionId, DraftDocument draft, List<StepRecord> auditTrail) {

    public DraftSessionSummary {
        auditTrail = auditTrail == null ? List.of() : List.copyOf(auditTrail);
    }
}
