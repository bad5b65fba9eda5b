package com.hangar.core.model;

import java.time.Instant;
import java.util.List;

/**
 * What the container runtime reports for a container right now. Never persisted.
 *
 * @param id                 container id
 * @param name               container name without the leading slash
 * @param status             runtime status string (created, running, exited, ...)
 * @param running            whether the container is running
 * @param ports              published host ports
 * @param createdAt          container creation time
 * @param startedAt          last start time, or {@code null}
 * @param memoryUsageBytes   point-in-time memory usage, 0 when unknown
 * @param cpuPercent         point-in-time CPU usage in percent, 0 when unknown
 */
public record RuntimeContainerInfo(
    String id,
    String name,
    String status,
    boolean running,
    List<PortMapping> ports,
    Instant createdAt,
    Instant startedAt,
    long memoryUsageBytes,
    double cpuPercent
) {}
