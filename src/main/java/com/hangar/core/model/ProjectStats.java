package com.hangar.core.model;

/**
 * Fleet-wide counts and usage for reporting.
 */
public record ProjectStats(
    int totalProjects,
    int runningProjects,
    int stoppedProjects,
    int erroredProjects,
    long totalStorageBytes,
    String totalStorage,
    long totalMemoryBytes,
    String totalMemoryUsed
) {}
