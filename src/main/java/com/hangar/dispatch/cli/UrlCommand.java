package com.hangar.dispatch.cli;

import com.hangar.lifecycle.ProjectOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: hangar url &lt;project&gt; [--admin]
 * <p>
 * Prints the bare URL so it can be used in scripts.
 */
@Command(name = "url", mixinStandardHelpOptions = true, description = "Print a project's URL")
@Component
public class UrlCommand implements Runnable {

    @Parameters(index = "0", description = "Project id or slug")
    private String project;

    @Option(names = {"--admin", "-a"}, description = "Print the admin dashboard URL instead")
    private boolean admin;

    private final ProjectOrchestrator orchestrator;

    public UrlCommand(ProjectOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        System.out.println(admin ? orchestrator.resolveAdminUrl(project) : orchestrator.resolveUrl(project));
    }
}
