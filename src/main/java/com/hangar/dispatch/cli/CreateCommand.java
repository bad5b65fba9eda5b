package com.hangar.dispatch.cli;

import com.hangar.core.model.ConfigOverrides;
import com.hangar.core.model.CreateProjectInput;
import com.hangar.core.model.Project;
import com.hangar.lifecycle.ProjectOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: hangar create &lt;name&gt;
 * <p>
 * Provisions a new PocketBase instance and prints where to reach it.
 */
@Command(name = "create", mixinStandardHelpOptions = true, description = "Create and start a new project")
@Component
public class CreateCommand implements Runnable {

    @Parameters(index = "0", description = "Project name")
    private String name;

    @Option(names = {"--slug", "-s"}, description = "URL slug (derived from the name when omitted)")
    private String slug;

    @Option(names = {"--description", "-d"}, description = "Free-text description")
    private String description;

    @Option(names = "--client-name", description = "Client the project belongs to")
    private String clientName;

    @Option(names = "--client-email", description = "Client contact email")
    private String clientEmail;

    @Option(names = "--memory", description = "Memory limit, e.g. 256m or 1g")
    private String memoryLimit;

    @Option(names = "--cpu", description = "CPU limit in cores, e.g. 0.5")
    private String cpuLimit;

    private final ProjectOrchestrator orchestrator;

    public CreateCommand(ProjectOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        ConsoleOutput.info("Creating project " + name + "...");
        ConfigOverrides overrides = memoryLimit != null || cpuLimit != null
                ? new ConfigOverrides(memoryLimit, cpuLimit, null, null, null, null)
                : null;
        Project project = orchestrator.create(
                new CreateProjectInput(name, slug, description, clientName, clientEmail, overrides, null));

        ConsoleOutput.success("Project " + project.getSlug() + " created");
        ConsoleOutput.field("ID", project.getId());
        ConsoleOutput.field("Status", ConsoleOutput.status(project.getStatus()));
        ConsoleOutput.field("Port", project.getPort());
        ConsoleOutput.field("URL", orchestrator.urlOf(project));
        ConsoleOutput.field("Admin", orchestrator.adminUrlOf(project));
        ConsoleOutput.info("Admin credentials: hangar credentials show " + project.getSlug());
    }
}
