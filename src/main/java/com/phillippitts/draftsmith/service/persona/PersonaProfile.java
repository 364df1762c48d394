package com.phillippitts.draftsmith.service.persona;

import java.util.Objects;

/** Voice a session writes in: tone and intended audience. */
public record PersonaProfile(String id, String name, String tone, String audience) {

    public PersonaProfile {
        Objects.requireNonNull(id, "id");
        name = name == null ? id : name;
    }
}
