package com.hangar.dispatch.cli;

import com.hangar.core.model.ProjectStats;
import com.hangar.lifecycle.ProjectOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "stats", mixinStandardHelpOptions = true, description = "Show fleet-wide counts and usage")
@Component
public class StatsCommand implements Runnable {

    private final ProjectOrchestrator orchestrator;

    public StatsCommand(ProjectOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        ProjectStats stats = orchestrator.stats();
        ConsoleOutput.printBanner();
        ConsoleOutput.field("Projects", stats.totalProjects());
        ConsoleOutput.field("Running", stats.runningProjects());
        ConsoleOutput.field("Stopped", stats.stoppedProjects());
        ConsoleOutput.field("Errored", stats.erroredProjects());
        ConsoleOutput.field("Storage", stats.totalStorage());
        ConsoleOutput.field("Memory", stats.totalMemoryUsed());
    }
}
