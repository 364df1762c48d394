package com.phillippitts.draftsmith.domain.session;

public record PointEvaluation(String pointId, boolean compliant, String notes, String evidence) {
}
