package com.hangar.dispatch.cli;

import com.hangar.lifecycle.ProjectOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "logs", mixinStandardHelpOptions = true, description = "Show the tail of a project's container logs")
@Component
public class LogsCommand implements Runnable {

    @Parameters(index = "0", description = "Project id or slug")
    private String project;

    @Option(names = {"--tail", "-n"}, description = "Number of lines (default: ${DEFAULT-VALUE})",
            defaultValue = "100")
    private int tail;

    private final ProjectOrchestrator orchestrator;

    public LogsCommand(ProjectOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        System.out.print(orchestrator.logs(project, tail));
        System.out.flush();
    }
}
