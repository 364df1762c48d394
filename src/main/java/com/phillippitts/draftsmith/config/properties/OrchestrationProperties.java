package com.phillippitts.draftsmith.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the session orchestrator.
 */
@Validated
@ConfigurationProperties(prefix = "orchestration")
public class OrchestrationProperties {

    static final String DEFAULT_BACKEND = "openai";

    /** Backend key used when a step payload does not name a provider. */
    @NotBlank
    private final String defaultBackend;

    @ConstructorBinding
    public OrchestrationProperties(String defaultBackend) {
        this.defaultBackend = defaultBackend == null || defaultBackend.isBlank() ? DEFAULT_BACKEND : defaultBackend;
    }

    public String getDefaultBackend() {
        return defaultBackend;
    }
}
