package com.hangar.core.model;

import java.time.Instant;

/**
 * Bootstrap admin identity for one project. Name, slug and domain are copied
 * in so the record can be shown without a catalog lookup.
 */
public record Credentials(
    String projectId,
    String projectName,
    String projectSlug,
    String domain,
    String adminEmail,
    String adminPassword,
    Instant createdAt,
    Instant updatedAt
) {

    @Override
    public String toString() {
        // adminPassword deliberately left out
        return "Credentials[" + projectSlug + " (" + projectId + "), adminEmail=" + adminEmail + "]";
    }
}
