package com.hangar.core.model;

/**
 * Partial {@link ProjectConfig}; {@code null} fields keep the current value.
 */
public record ConfigOverrides(
    String memoryLimit,
    String cpuLimit,
    Boolean autoBackup,
    String backupSchedule,
    String customDomain,
    EnabledFeatures enabledFeatures
) {
    public static ConfigOverrides none() {
        return new ConfigOverrides(null, null, null, null, null, null);
    }
}
