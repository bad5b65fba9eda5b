package com.hangar.dispatch.cli;

import com.hangar.core.model.Project;
import com.hangar.lifecycle.ProjectOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "restart", mixinStandardHelpOptions = true, description = "Restart a project")
@Component
public class RestartCommand implements Runnable {

    @Parameters(index = "0", description = "Project id or slug")
    private String project;

    private final ProjectOrchestrator orchestrator;

    public RestartCommand(ProjectOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        Project p = orchestrator.restart(project);
        ConsoleOutput.success("Project " + p.getSlug() + " restarted (" + ConsoleOutput.status(p.getStatus()) + ")");
    }
}
