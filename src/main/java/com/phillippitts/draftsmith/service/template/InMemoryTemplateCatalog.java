package com.phillippitts.draftsmith.service.template;

import com.phillippitts.draftsmith.domain.CollaboratorFault;
import com.phillippitts.draftsmith.domain.Result;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/** Thread-safe {@link TemplateCatalog} populated programmatically. */
public class InMemoryTemplateCatalog implements TemplateCatalog {

    public static final String NOT_FOUND = "template_not_found";

    private final Map<String, TemplateDescriptor> templates = new ConcurrentHashMap<>();

    public void register(TemplateDescriptor template) {
        Objects.requireNonNull(template, "template");
        templates.put(template.id(), template);
    }

    @Override
    public Result<TemplateDescriptor, CollaboratorFault> loadTemplate(String templateId) {
        TemplateDescriptor template = templateId == null ? null : templates.get(templateId);
        if (template == null) {
            return Result.err(CollaboratorFault.of(NOT_FOUND, "Template " + templateId + " not found"));
        }
        return Result.ok(template);
    }
}
