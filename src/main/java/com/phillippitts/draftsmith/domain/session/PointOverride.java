package com.phillippitts.draftsmith.domain.session;

/**
 * Caller-supplied replacement for a template point's instructions and/or priority.
 * Null fields keep the template's value.
 */
public record PointOverride(String instructions, Integer priority) {

    public static final PointOverride NONE = new PointOverride(null, null);
}
