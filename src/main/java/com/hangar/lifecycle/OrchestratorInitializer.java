package com.hangar.lifecycle;

import com.hangar.config.HangarProperties;
import com.hangar.core.error.RuntimeUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Prepares the runtime and reconciles recorded status with the containers
 * before any command or request is served.
 *
 * <p>An unreachable Docker daemon is logged, not fatal: read-only commands
 * (list, info, credentials) still work against the catalog.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class OrchestratorInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorInitializer.class);

    private final ProjectOrchestrator orchestrator;
    private final HangarProperties properties;

    public OrchestratorInitializer(ProjectOrchestrator orchestrator, HangarProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            orchestrator.initialize();
        } catch (RuntimeUnavailableException e) {
            log.warn("Container runtime unavailable, skipping startup reconciliation: {}", e.getMessage());
            return;
        }
        if (properties.isReconcileOnStartup()) {
            var corrections = orchestrator.reconcile();
            corrections.forEach(c -> log.info("Reconciled {}: {} -> {}", c.slug(), c.from().value(), c.to().value()));
        }
    }
}
