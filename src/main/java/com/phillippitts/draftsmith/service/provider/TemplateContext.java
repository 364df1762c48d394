package com.phillippitts.draftsmith.service.provider;

import java.util.List;

/**
 * Optional persona/template enrichment of a request. Any field may be absent.
 *
 * @param templateId template identifier or null
 * @param personaId persona identifier or null
 * @param points ordered template points, never null
 */
public record TemplateContext(String templateId, String personaId, List<PointContext> points) {

    public TemplateContext {
        points = points == null ? List.of() : List.copyOf(points);
    }

    public boolean isEmpty() {
        return templateId == null && personaId == null && points.isEmpty();
    }
}
