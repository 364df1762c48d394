package com.phillippitts.draftsmith.service.template;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** A document template: an id, a display name and its ordered points. */
public record TemplateDescriptor(String id, String name, List<TemplatePoint> points) {

    public TemplateDescriptor {
        Objects.requireNonNull(id, "id");
        name = name == null ? id : name;
        points = points == null ? List.of() : List.copyOf(points);
    }

    public Optional<TemplatePoint> point(String pointId) {
        return points.stream().filter(p -> p.id().equals(pointId)).findFirst();
    }
}
