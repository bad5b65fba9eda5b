package com.hangar.core.model;

/**
 * Partial {@link Credentials}; {@code null} fields keep the stored value.
 */
public record CredentialsUpdate(
    String projectName,
    String projectSlug,
    String domain,
    String adminEmail,
    String adminPassword
) {}
