package com.hangar.dispatch.cli;

import com.hangar.core.model.Project;
import com.hangar.lifecycle.ProjectOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "stop", mixinStandardHelpOptions = true, description = "Stop a running project")
@Component
public class StopCommand implements Runnable {

    @Parameters(index = "0", description = "Project id or slug")
    private String project;

    private final ProjectOrchestrator orchestrator;

    public StopCommand(ProjectOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        Project p = orchestrator.stop(project);
        ConsoleOutput.success("Project " + p.getSlug() + " stopped (" + ConsoleOutput.status(p.getStatus()) + ")");
    }
}
