package com.hangar.catalog;

import com.hangar.core.model.Project;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * On-disk shape of {@code metadata.json}.
 */
public class CatalogDocument {

    private Map<String, Project> projects = new LinkedHashMap<>();
    private Instant lastUpdated;

    public Map<String, Project> getProjects() { return projects; }
    public void setProjects(Map<String, Project> projects) {
        this.projects = projects != null ? new LinkedHashMap<>(projects) : new LinkedHashMap<>();
    }
    public Instant getLastUpdated() { return lastUpdated; }
    public void setLastUpdated(Instant lastUpdated) { this.lastUpdated = lastUpdated; }
}
