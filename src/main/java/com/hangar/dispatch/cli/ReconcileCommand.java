package com.hangar.dispatch.cli;

import com.hangar.core.model.StatusCorrection;
import com.hangar.lifecycle.ProjectOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "reconcile", mixinStandardHelpOptions = true,
        description = "Align recorded project status with the containers Docker reports")
@Component
public class ReconcileCommand implements Runnable {

    private final ProjectOrchestrator orchestrator;

    public ReconcileCommand(ProjectOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        var corrections = orchestrator.reconcile();
        if (corrections.isEmpty()) {
            ConsoleOutput.success("All projects in sync");
            return;
        }
        for (StatusCorrection c : corrections) {
            ConsoleOutput.warn(c.slug() + ": " + ConsoleOutput.status(c.from()) + " -> " + ConsoleOutput.status(c.to()));
        }
        ConsoleOutput.info(corrections.size() + " project" + (corrections.size() != 1 ? "s" : "") + " corrected");
    }
}
