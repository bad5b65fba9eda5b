package com.hangar.vault;

import com.hangar.core.model.Credentials;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * On-disk shape of {@code database-credentials.json}.
 */
public class VaultDocument {

    private Map<String, Credentials> databases = new LinkedHashMap<>();
    private Instant lastUpdated;

    public Map<String, Credentials> getDatabases() { return databases; }
    public void setDatabases(Map<String, Credentials> databases) {
        this.databases = databases != null ? new LinkedHashMap<>(databases) : new LinkedHashMap<>();
    }
    public Instant getLastUpdated() { return lastUpdated; }
    public void setLastUpdated(Instant lastUpdated) { this.lastUpdated = lastUpdated; }
}
