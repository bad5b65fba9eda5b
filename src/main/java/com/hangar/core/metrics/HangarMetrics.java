package com.hangar.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for project lifecycle operations.
 */
@Service
public class HangarMetrics {

    private final MeterRegistry registry;

    public HangarMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts one lifecycle operation (create, start, stop, restart, delete, ...).
     *
     * @param operation operation name
     * @param success   whether it completed without throwing
     */
    public void recordOperation(String operation, boolean success) {
        Counter.builder("hangar.operations.total")
                .tag("operation", operation)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordDataOperation(String kind, long ms) {
        Timer.builder("hangar.data.duration")
                .description("Backup and restore wall-clock time")
                .tag("kind", kind)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStatusCorrection(String from, String to) {
        Counter.builder("hangar.reconcile.corrections")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void recordBootstrap(boolean success, int attempts) {
        Counter.builder("hangar.bootstrap.total")
                .tag("outcome", success ? "success" : "timeout")
                .register(registry)
                .increment();
        Counter.builder("hangar.bootstrap.attempts")
                .register(registry)
                .increment(attempts);
    }
}
