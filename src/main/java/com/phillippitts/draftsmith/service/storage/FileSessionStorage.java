package com.phillippitts.draftsmith.service.storage;

import com.phillippitts.draftsmith.domain.CollaboratorFault;
import com.phillippitts.draftsmith.domain.Result;
import com.phillippitts.draftsmith.domain.session.Session;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Stores each session as {@code <sessions-dir>/<session-id>.json}.
 *
 * <p>Writes go to a temporary file in the same directory that is then moved over the target,
 * so readers never observe a partially written snapshot.
 */
public class FileSessionStorage implements SessionStorage {

    private static final Logger LOG = LogManager.getLogger(FileSessionStorage.class);

    public static final String STORAGE_ERROR = "storage_error";
    private static final String SUFFIX = ".json";

    private final Path sessionsDir;

    public FileSessionStorage(Path sessionsDir) {
        this.sessionsDir = Objects.requireNonNull(sessionsDir, "sessionsDir");
    }

    @Override
    public Result<String, CollaboratorFault> saveSession(Session session) {
        Objects.requireNonNull(session, "session");
        Path target = sessionsDir.resolve(session.id() + SUFFIX);
        Path tmp = null;
        try {
            Files.createDirectories(sessionsDir);
            tmp = Files.createTempFile(sessionsDir, session.id(), ".tmp");
            Files.writeString(tmp, SessionJsonMapper.toJson(session).toString(2), StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            LOG.debug("Saved session {} to {}", session.id(), target);
            return Result.ok(target.toString());
        } catch (IOException e) {
            if (tmp != null && !tmp.toFile().delete()) {
                LOG.debug("Temporary snapshot {} was not removed", tmp);
            }
            LOG.warn("Failed to save session {}: {}", session.id(), e.toString());
            return Result.err(CollaboratorFault.of(STORAGE_ERROR,
                    "Failed to save session " + session.id() + ": " + e.getMessage()));
        }
    }

    @Override
    public Result<List<String>, CollaboratorFault> listSessionIds() {
        if (!Files.isDirectory(sessionsDir)) {
            return Result.ok(List.of());
        }
        try (Stream<Path> files = Files.list(sessionsDir)) {
            List<String> ids = files
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                    .sorted()
                    .collect(Collectors.toList());
            return Result.ok(ids);
        } catch (IOException e) {
            LOG.warn("Failed to list sessions in {}: {}", sessionsDir, e.toString());
            return Result.err(CollaboratorFault.of(STORAGE_ERROR, "Failed to list sessions: " + e.getMessage()));
        }
    }
}
