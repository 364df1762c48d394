package com.phillippitts.draftsmith.service.storage;

import com.phillippitts.draftsmith.domain.CollaboratorFault;
import com.phillippitts.draftsmith.domain.Result;
import com.phillippitts.draftsmith.domain.session.Session;

import java.util.List;

/**
 * Persists session snapshots. Implementations are not required to be safe across processes.
 */
public interface SessionStorage {

    /**
     * Writes a snapshot, replacing any earlier snapshot of the same session.
     *
     * @return location the snapshot was written to, or a {@code storage_error} fault
     */
    Result<String, CollaboratorFault> saveSession(Session session);

    /** Ids of every stored session, sorted. */
    Result<List<String>, CollaboratorFault> listSessionIds();
}
