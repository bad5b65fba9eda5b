package com.hangar.core.model;

import java.util.Map;

/**
 * Bytes on disk per project directory and in total.
 */
public record StorageStats(long totalSize, Map<String, Long> projectSizes) {}
