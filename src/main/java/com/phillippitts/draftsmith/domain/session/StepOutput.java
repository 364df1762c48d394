package com.phillippitts.draftsmith.domain.session;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What an accepted step produced. A backend failure is recorded as {@link Failed} rather than
 * aborting the step, so callers inspect the output to detect it.
 */
public interface StepOutput {

    /** Discriminator used in persisted snapshots: generated, failed or skipped. */
    String type();

    /**
     * Backend output.
     *
     * @param model model reported by the backend, may be null
     */
    record Generated(String content, int promptTokens, int completionTokens, int totalTokens,
                     String finishReason, String model) implements StepOutput {

        public Generated {
            Objects.requireNonNull(content, "content");
        }

        @Override
        public String type() {
            return "generated";
        }
    }

    /**
     * Backend failure recorded in place of content.
     *
     * @param code provider fault code
     */
    record Failed(String code, String message, boolean recoverable, Map<String, Object> details)
            implements StepOutput {

        public Failed {
            Objects.requireNonNull(code, "code");
            Objects.requireNonNull(message, "message");
            details = details == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        }

        @Override
        public String type() {
            return "failed";
        }
    }

    /** No backend call was made for the step (approval, regenerate, or no hub configured). */
    record Skipped(String reason) implements StepOutput {

        @Override
        public String type() {
            return "skipped";
        }
    }
}
