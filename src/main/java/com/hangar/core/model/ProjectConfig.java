package com.hangar.core.model;

/**
 * Resource limits and toggles for a project.
 *
 * @param memoryLimit     human-readable memory cap, e.g. {@code 256m}
 * @param cpuLimit        CPU share as a decimal count of cores, e.g. {@code 0.5}
 * @param autoBackup      whether scheduled backups are wanted
 * @param backupSchedule  cron expression, recorded only
 * @param customDomain    custom domain, recorded only
 * @param enabledFeatures feature toggles
 */
public record ProjectConfig(
    String memoryLimit,
    String cpuLimit,
    boolean autoBackup,
    String backupSchedule,
    String customDomain,
    EnabledFeatures enabledFeatures
) {

    /**
     * Shallow merge: each non-null override replaces the current value.
     */
    public ProjectConfig merge(ConfigOverrides overrides) {
        if (overrides == null) {
            return this;
        }
        return new ProjectConfig(
                overrides.memoryLimit() != null ? overrides.memoryLimit() : memoryLimit,
                overrides.cpuLimit() != null ? overrides.cpuLimit() : cpuLimit,
                overrides.autoBackup() != null ? overrides.autoBackup() : autoBackup,
                overrides.backupSchedule() != null ? overrides.backupSchedule() : backupSchedule,
                overrides.customDomain() != null ? overrides.customDomain() : customDomain,
                overrides.enabledFeatures() != null ? overrides.enabledFeatures() : enabledFeatures
        );
    }
}
