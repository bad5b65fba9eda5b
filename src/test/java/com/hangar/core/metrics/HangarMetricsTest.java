package com.hangar.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HangarMetricsTest {

    private SimpleMeterRegistry registry;
    private HangarMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new HangarMetrics(registry);
    }

    @Test
    @DisplayName("recordOperation counts by operation and outcome")
    void recordOperation() {
        metrics.recordOperation("start", true);
        metrics.recordOperation("start", true);
        metrics.recordOperation("start", false);

        var ok = registry.find("hangar.operations.total")
                .tag("operation", "start").tag("outcome", "success").counter();
        var failed = registry.find("hangar.operations.total")
                .tag("operation", "start").tag("outcome", "failure").counter();

        assertNotNull(ok);
        assertNotNull(failed);
        assertEquals(2.0, ok.count());
        assertEquals(1.0, failed.count());
    }

    @Test
    @DisplayName("recordDataOperation times backups and restores separately")
    void recordDataOperation() {
        metrics.recordDataOperation("backup", 1200);
        metrics.recordDataOperation("restore", 300);

        var backup = registry.find("hangar.data.duration").tag("kind", "backup").timer();
        assertNotNull(backup);
        assertEquals(1, backup.count());
        assertEquals(1200.0, backup.totalTime(java.util.concurrent.TimeUnit.MILLISECONDS));
        assertNotNull(registry.find("hangar.data.duration").tag("kind", "restore").timer());
    }

    @Test
    @DisplayName("recordStatusCorrection tags the transition")
    void recordStatusCorrection() {
        metrics.recordStatusCorrection("running", "stopped");
        var counter = registry.find("hangar.reconcile.corrections")
                .tag("from", "running").tag("to", "stopped").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordBootstrap counts outcome and accumulates attempts")
    void recordBootstrap() {
        metrics.recordBootstrap(true, 3);
        metrics.recordBootstrap(false, 10);

        assertEquals(1.0, registry.find("hangar.bootstrap.total").tag("outcome", "success").counter().count());
        assertEquals(1.0, registry.find("hangar.bootstrap.total").tag("outcome", "timeout").counter().count());
        assertEquals(13.0, registry.find("hangar.bootstrap.attempts").counter().count());
    }
}
