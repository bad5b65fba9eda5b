package com.hangar.core.model;

import java.util.Map;

/**
 * Partial update; {@code null} fields are left untouched, {@code metadata}
 * and {@code config} are merged over the current values.
 */
public record UpdateProjectInput(
    String name,
    String description,
    String clientName,
    String clientEmail,
    ConfigOverrides config,
    Map<String, Object> metadata
) {}
