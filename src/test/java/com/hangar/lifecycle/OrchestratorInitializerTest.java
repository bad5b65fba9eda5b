package com.hangar.lifecycle;

import com.hangar.config.HangarProperties;
import com.hangar.core.error.RuntimeUnavailableException;
import com.hangar.core.model.ProjectStatus;
import com.hangar.core.model.StatusCorrection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.*;

class OrchestratorInitializerTest {

    private final ProjectOrchestrator orchestrator = mock(ProjectOrchestrator.class);
    private final HangarProperties properties = new HangarProperties();
    private final OrchestratorInitializer initializer = new OrchestratorInitializer(orchestrator, properties);

    @Test
    @DisplayName("Initializes and reconciles on startup")
    void reconcilesOnStartup() {
        when(orchestrator.reconcile()).thenReturn(List.of(
                new StatusCorrection("id", "acme", ProjectStatus.RUNNING, ProjectStatus.STOPPED)));

        initializer.run(new DefaultApplicationArguments());

        verify(orchestrator).initialize();
        verify(orchestrator).reconcile();
    }

    @Test
    @DisplayName("Startup reconciliation can be switched off")
    void reconcileDisabled() {
        properties.setReconcileOnStartup(false);

        initializer.run(new DefaultApplicationArguments());

        verify(orchestrator).initialize();
        verify(orchestrator, never()).reconcile();
    }

    @Test
    @DisplayName("An unreachable daemon is not fatal")
    void daemonDown() {
        doThrow(new RuntimeUnavailableException("Cannot connect", null)).when(orchestrator).initialize();

        assertDoesNotThrow(() -> initializer.run(new DefaultApplicationArguments()));

        verify(orchestrator, never()).reconcile();
    }
}
