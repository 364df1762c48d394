package com.phillippitts.draftsmith.service.template;

import java.util.Objects;

/**
 * One point a generated document should address.
 *
 * @param priority lower values are more important
 */
public record TemplatePoint(String id, String title, String instructions, int priority) {

    public TemplatePoint {
        Objects.requireNonNull(id, "id");
        title = title == null ? id : title;
        instructions = instructions == null ? "" : instructions;
    }
}
