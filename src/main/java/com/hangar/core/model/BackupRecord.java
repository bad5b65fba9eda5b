package com.hangar.core.model;

import java.time.Instant;

/**
 * One {@code .tar.gz} snapshot of a project's data directory.
 *
 * @param id        the filename without its {@code .tar.gz} extension
 * @param projectId owning project
 * @param filename  {@code <slug>-<timestamp>.tar.gz}
 * @param size      archive size in bytes
 * @param createdAt creation time (file modification time when listed)
 */
public record BackupRecord(
    String id,
    String projectId,
    String filename,
    long size,
    Instant createdAt
) {}
