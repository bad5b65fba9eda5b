package com.hangar.dispatch.cli;

import com.hangar.core.model.Project;
import com.hangar.core.util.ByteSizes;
import com.hangar.lifecycle.ProjectOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: hangar info &lt;project&gt;
 * <p>
 * Shows the recorded project plus the live container view when there is one.
 */
@Command(name = "info", mixinStandardHelpOptions = true, description = "Show project details")
@Component
public class InfoCommand implements Runnable {

    @Parameters(index = "0", description = "Project id or slug")
    private String project;

    private final ProjectOrchestrator orchestrator;

    public InfoCommand(ProjectOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        Project p = orchestrator.get(project);
        System.out.println();
        System.out.println("PROJECT " + p.getName());
        ConsoleOutput.field("ID", p.getId());
        ConsoleOutput.field("Slug", p.getSlug());
        ConsoleOutput.field("Status", ConsoleOutput.status(p.getStatus()));
        ConsoleOutput.field("Description", p.getDescription());
        ConsoleOutput.field("Client", p.getClientName());
        ConsoleOutput.field("Client email", p.getClientEmail());
        ConsoleOutput.field("Container", p.getContainerName());
        ConsoleOutput.field("Port", p.getPort());
        ConsoleOutput.field("URL", orchestrator.urlOf(p));
        ConsoleOutput.field("Admin", orchestrator.adminUrlOf(p));
        if (p.getConfig() != null) {
            ConsoleOutput.field("Memory limit", p.getConfig().memoryLimit());
            ConsoleOutput.field("CPU limit", p.getConfig().cpuLimit());
        }
        ConsoleOutput.field("Created", p.getCreatedAt());
        ConsoleOutput.field("Updated", p.getUpdatedAt());

        if (p.isDeleted()) {
            return;
        }
        orchestrator.containerInfo(project).ifPresentOrElse(info -> {
            System.out.println();
            System.out.println("CONTAINER " + info.name());
            ConsoleOutput.field("State", info.status());
            ConsoleOutput.field("Started", info.startedAt());
            if (info.running()) {
                ConsoleOutput.field("Memory", ByteSizes.format(info.memoryUsageBytes()));
                ConsoleOutput.field("CPU", String.format("%.1f%%", info.cpuPercent()));
            }
        }, () -> ConsoleOutput.warn("No container found for " + p.getSlug()));
    }
}
