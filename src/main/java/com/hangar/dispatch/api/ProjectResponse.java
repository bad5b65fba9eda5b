package com.hangar.dispatch.api;

import com.hangar.core.model.Project;
import com.hangar.core.model.ProjectConfig;
import com.hangar.core.model.RuntimeContainerInfo;

import java.time.Instant;
import java.util.Map;

/**
 * Project as returned by the API, with its resolved URLs and, on single-project
 * reads, the live container view.
 */
public record ProjectResponse(
    String id,
    String name,
    String slug,
    String description,
    String clientName,
    String clientEmail,
    String status,
    String containerName,
    int port,
    String domain,
    Instant createdAt,
    Instant updatedAt,
    ProjectConfig config,
    Map<String, Object> metadata,
    Urls urls,
    RuntimeContainerInfo container
) {

    public record Urls(String api, String admin) {}

    public static ProjectResponse of(Project p, String url, String adminUrl, RuntimeContainerInfo container) {
        return new ProjectResponse(p.getId(), p.getName(), p.getSlug(), p.getDescription(),
                p.getClientName(), p.getClientEmail(), p.getStatus().value(), p.getContainerName(),
                p.getPort(), p.getDomain(), p.getCreatedAt(), p.getUpdatedAt(), p.getConfig(),
                p.getMetadata(), new Urls(url, adminUrl), container);
    }
}
