package com.phillippitts.draftsmith.service.persona;

import com.phillippitts.draftsmith.domain.CollaboratorFault;
import com.phillippitts.draftsmith.domain.Result;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/** Thread-safe {@link PersonaCatalog} populated programmatically. */
public class InMemoryPersonaCatalog implements PersonaCatalog {

    public static final String NOT_FOUND = "persona_not_found";

    private final Map<String, PersonaProfile> personas = new ConcurrentHashMap<>();

    public void register(PersonaProfile persona) {
        Objects.requireNonNull(persona, "persona");
        personas.put(persona.id(), persona);
    }

    @Override
    public Result<PersonaProfile, CollaboratorFault> getPersona(String personaId) {
        PersonaProfile persona = personaId == null ? null : personas.get(personaId);
        if (persona == null) {
            return Result.err(CollaboratorFault.of(NOT_FOUND, "Persona " + personaId + " not found"));
        }
        return Result.ok(persona);
    }
}
