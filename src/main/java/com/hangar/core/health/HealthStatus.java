package com.hangar.core.health;

import java.util.Collection;
import java.util.Map;

/**
 * Result of one component check. {@code DEGRADED} is reported but does not
 * fail the overall health; {@code DOWN} does.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }

    /**
     * DOWN if any check is down, else DEGRADED if any is degraded, else UP.
     */
    public static Status overall(Collection<HealthStatus> checks) {
        Status overall = Status.UP;
        for (HealthStatus check : checks) {
            if (check.isDown()) {
                return Status.DOWN;
            }
            if (check.status() == Status.DEGRADED) {
                overall = Status.DEGRADED;
            }
        }
        return overall;
    }
}
