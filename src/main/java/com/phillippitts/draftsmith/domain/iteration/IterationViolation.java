package com.phillippitts.draftsmith.domain.iteration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A rejected step, with structured details (for {@code unexpected-step}: {@code expected} and
 * {@code received} wire names).
 */
public record IterationViolation(ViolationCode code, String message, Map<String, Object> details) {

    public IterationViolation {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
