package com.phillippitts.draftsmith.service.template;

import com.phillippitts.draftsmith.domain.CollaboratorFault;
import com.phillippitts.draftsmith.domain.Result;

/**
 * Source of document templates consulted when a session references one.
 */
public interface TemplateCatalog {

    /**
     * @param templateId template identifier
     * @return the template, or a {@code template_not_found} fault
     */
    Result<TemplateDescriptor, CollaboratorFault> loadTemplate(String templateId);
}
