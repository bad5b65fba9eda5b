package com.hangar.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One tenant's database instance as tracked by the catalog.
 *
 * <p>Mutable so the orchestrator can carry an in-flight copy through a
 * multi-step workflow and write it back after each step. The catalog only
 * ever hands out copies.
 */
public class Project {

    private String id;
    private String name;
    private String slug;
    private String description;
    private String clientName;
    private String clientEmail;
    private ProjectStatus status;
    private String containerName = "";
    private int port;
    private String domain;
    private Instant createdAt;
    private Instant updatedAt;
    private ProjectConfig config;
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public Project() {
    }

    public Project copy() {
        var copy = new Project();
        copy.id = id;
        copy.name = name;
        copy.slug = slug;
        copy.description = description;
        copy.clientName = clientName;
        copy.clientEmail = clientEmail;
        copy.status = status;
        copy.containerName = containerName;
        copy.port = port;
        copy.domain = domain;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        copy.config = config;
        copy.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        return copy;
    }

    @JsonIgnore
    public boolean isDeleted() {
        return status == ProjectStatus.DELETED;
    }

    public boolean hasContainer() {
        return containerName != null && !containerName.isBlank();
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getSlug() { return slug; }
    public void setSlug(String slug) { this.slug = slug; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getClientName() { return clientName; }
    public void setClientName(String clientName) { this.clientName = clientName; }
    public String getClientEmail() { return clientEmail; }
    public void setClientEmail(String clientEmail) { this.clientEmail = clientEmail; }
    public ProjectStatus getStatus() { return status; }
    public void setStatus(ProjectStatus status) { this.status = status; }
    public String getContainerName() { return containerName; }
    public void setContainerName(String containerName) { this.containerName = containerName; }
    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }
    public String getDomain() { return domain; }
    public void setDomain(String domain) { this.domain = domain; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public ProjectConfig getConfig() { return config; }
    public void setConfig(ProjectConfig config) { this.config = config; }
    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) { this.metadata = metadata; }

    @Override
    public String toString() {
        return "Project[" + slug + " (" + id + "), status=" + (status != null ? status.value() : null)
                + ", port=" + port + "]";
    }
}
