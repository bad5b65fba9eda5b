package com.hangar.core.model;

/**
 * One status change applied by reconciliation.
 */
public record StatusCorrection(
    String projectId,
    String slug,
    ProjectStatus from,
    ProjectStatus to
) {}
