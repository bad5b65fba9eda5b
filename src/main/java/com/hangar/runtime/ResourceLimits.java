package com.hangar.runtime;

import com.hangar.core.error.ValidationException;
import com.hangar.core.model.ProjectConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates human-readable limits into Docker units.
 *
 * <ul>
 *   <li>memory: {@code 512}, {@code 64k}, {@code 256m}, {@code 1g} to bytes</li>
 *   <li>cpu: decimal cores ({@code 0.5}) to nano-CPUs ({@code 500000000})</li>
 * </ul>
 */
public final class ResourceLimits {

    private static final Logger log = LoggerFactory.getLogger(ResourceLimits.class);

    private static final Pattern MEMORY = Pattern.compile("^(\\d+)([kmg]?)$", Pattern.CASE_INSENSITIVE);

    public static final long DEFAULT_MEMORY_BYTES = 256L * 1024 * 1024;
    public static final long DEFAULT_NANO_CPUS = 500_000_000L;

    private ResourceLimits() {}

    public static boolean isValidMemory(String limit) {
        return limit != null && MEMORY.matcher(limit.trim()).matches();
    }

    public static boolean isValidCpu(String limit) {
        if (limit == null || limit.isBlank()) {
            return false;
        }
        try {
            double value = Double.parseDouble(limit.trim());
            return Double.isFinite(value) && value > 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * Unparseable values fall back to {@link #DEFAULT_MEMORY_BYTES}.
     */
    public static long memoryBytes(String limit) {
        if (limit == null) {
            return DEFAULT_MEMORY_BYTES;
        }
        Matcher m = MEMORY.matcher(limit.trim());
        if (!m.matches()) {
            log.warn("Unparseable memory limit '{}', using default", limit);
            return DEFAULT_MEMORY_BYTES;
        }
        long value = Long.parseLong(m.group(1));
        return switch (m.group(2).toLowerCase(Locale.ROOT)) {
            case "k" -> value * 1024;
            case "m" -> value * 1024 * 1024;
            case "g" -> value * 1024 * 1024 * 1024;
            default -> value;
        };
    }

    /**
     * Unparseable values fall back to {@link #DEFAULT_NANO_CPUS}.
     */
    public static long nanoCpus(String limit) {
        if (!isValidCpu(limit)) {
            log.warn("Unparseable CPU limit '{}', using default", limit);
            return DEFAULT_NANO_CPUS;
        }
        return (long) Math.floor(Double.parseDouble(limit.trim()) * 1e9);
    }

    /**
     * @throws ValidationException if either limit cannot be parsed
     */
    public static void validate(ProjectConfig config) {
        if (!isValidMemory(config.memoryLimit())) {
            throw new ValidationException("Invalid memory limit '" + config.memoryLimit()
                    + "': expected a number with optional k, m or g suffix");
        }
        if (!isValidCpu(config.cpuLimit())) {
            throw new ValidationException("Invalid CPU limit '" + config.cpuLimit()
                    + "': expected a positive decimal number of cores");
        }
    }
}
