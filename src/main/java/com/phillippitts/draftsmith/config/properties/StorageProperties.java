package com.phillippitts.draftsmith.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

/**
 * Session storage settings. File storage is enabled only when {@code storage.sessions-dir} is set.
 */
@ConfigurationProperties(prefix = "storage")
public class StorageProperties {

    private final String sessionsDir;

    @ConstructorBinding
    public StorageProperties(String sessionsDir) {
        this.sessionsDir = sessionsDir == null || sessionsDir.isBlank() ? null : sessionsDir.trim();
    }

    /** @return sessions directory, or null when persistence is off */
    public String getSessionsDir() {
        return sessionsDir;
    }

    public boolean isEnabled() {
        return sessionsDir != null;
    }
}
