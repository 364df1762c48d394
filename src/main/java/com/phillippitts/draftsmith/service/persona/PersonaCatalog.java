package com.phillippitts.draftsmith.service.persona;

import com.phillippitts.draftsmith.domain.CollaboratorFault;
import com.phillippitts.draftsmith.domain.Result;

/** Source of personas consulted when a session references one. */
public interface PersonaCatalog {

    Result<PersonaProfile, CollaboratorFault> getPersona(String personaId);
}
