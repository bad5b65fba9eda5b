package com.hangar.dispatch.cli;

import com.hangar.core.model.Project;
import com.hangar.lifecycle.ProjectOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: hangar delete &lt;project&gt; [--keep-data]
 * <p>
 * Without {@code --keep-data} the project's files, record and credentials are
 * purged; backups are left in place.
 */
@Command(name = "delete", aliases = "rm", mixinStandardHelpOptions = true, description = "Delete a project")
@Component
public class DeleteCommand implements Runnable {

    @Parameters(index = "0", description = "Project id or slug")
    private String project;

    @Option(names = "--keep-data", description = "Remove the container but keep the record and data")
    private boolean keepData;

    private final ProjectOrchestrator orchestrator;

    public DeleteCommand(ProjectOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        Project p = orchestrator.get(project);
        orchestrator.delete(project, keepData);
        if (keepData) {
            ConsoleOutput.success("Project " + p.getSlug() + " deleted, data kept");
        } else {
            ConsoleOutput.success("Project " + p.getSlug() + " deleted");
        }
    }
}
