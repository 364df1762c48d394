package com.phillippitts.draftsmith.service.provider;

import java.util.Objects;

/** Template point forwarded to the backend prompt. */
public record PointContext(String pointId, String instructions, int priority) {

    public PointContext {
        Objects.requireNonNull(pointId, "pointId");
        instructions = instructions == null ? "" : instructions;
    }
}
