package com.hangar.dispatch.cli;

import com.hangar.core.model.ProjectQuery;
import com.hangar.core.model.ProjectStatus;
import com.hangar.lifecycle.ProjectOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: hangar list
 */
@Command(name = "list", aliases = "ls", mixinStandardHelpOptions = true, description = "List projects")
@Component
public class ListCommand implements Runnable {

    @Option(names = "--status", description = "Only projects in this status: ${COMPLETION-CANDIDATES}")
    private ProjectStatus status;

    @Option(names = "--client", description = "Client name contains")
    private String clientName;

    @Option(names = {"--search", "-q"}, description = "Name, slug or description contains")
    private String search;

    @Option(names = "--limit", description = "Maximum number of projects")
    private Integer limit;

    @Option(names = "--offset", description = "Projects to skip", defaultValue = "0")
    private int offset;

    private final ProjectOrchestrator orchestrator;

    public ListCommand(ProjectOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        var projects = orchestrator.list(new ProjectQuery(status, clientName, search, limit, offset));
        if (projects.isEmpty()) {
            ConsoleOutput.info("No projects found");
            return;
        }
        System.out.println(String.format("  %-24s %-12s %-6s %s", "SLUG", "STATUS", "PORT", "URL"));
        for (var project : projects) {
            ConsoleOutput.projectRow(project, orchestrator.urlOf(project));
        }
        System.out.println();
        ConsoleOutput.info(projects.size() + " project" + (projects.size() != 1 ? "s" : ""));
    }
}
