package com.hangar.core.model;

import java.util.Map;

/**
 * Caller input for project creation. Only {@code name} is required; the slug
 * is derived from it when absent.
 */
public record CreateProjectInput(
    String name,
    String slug,
    String description,
    String clientName,
    String clientEmail,
    ConfigOverrides config,
    Map<String, Object> metadata
) {
    public static CreateProjectInput named(String name) {
        return new CreateProjectInput(name, null, null, null, null, null, null);
    }

    public static CreateProjectInput named(String name, String slug) {
        return new CreateProjectInput(name, slug, null, null, null, null, null);
    }
}
