package com.phillippitts.draftsmith.domain.session;

import java.time.Instant;

public record DocumentMetadata(Instant createdAt, Instant updatedAt, int version, boolean approved) {

    public static DocumentMetadata initial(Instant now) {
        return new DocumentMetadata(now, now, 1, false);
    }
}
