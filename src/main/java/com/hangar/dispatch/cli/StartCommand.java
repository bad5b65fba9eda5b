package com.hangar.dispatch.cli;

import com.hangar.core.model.Project;
import com.hangar.lifecycle.ProjectOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "start", mixinStandardHelpOptions = true, description = "Start a stopped project")
@Component
public class StartCommand implements Runnable {

    @Parameters(index = "0", description = "Project id or slug")
    private String project;

    private final ProjectOrchestrator orchestrator;

    public StartCommand(ProjectOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        Project p = orchestrator.start(project);
        ConsoleOutput.success("Project " + p.getSlug() + " started (" + ConsoleOutput.status(p.getStatus()) + ")");
    }
}
