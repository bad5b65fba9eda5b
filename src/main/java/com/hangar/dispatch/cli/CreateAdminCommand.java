package com.hangar.dispatch.cli;

import com.hangar.core.model.Credentials;
import com.hangar.lifecycle.ProjectOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: hangar create-admin &lt;project&gt;
 * <p>
 * Creates or resets the superuser of a running project. Used when the
 * automatic bootstrap after create gave up.
 */
@Command(name = "create-admin", mixinStandardHelpOptions = true,
        description = "Create or reset a project's admin account")
@Component
public class CreateAdminCommand implements Runnable {

    @Parameters(index = "0", description = "Project id or slug")
    private String project;

    @Option(names = {"--email", "-e"}, description = "Admin email (default: client email or configured default)")
    private String email;

    @Option(names = {"--password", "-p"}, description = "Admin password (generated when omitted)")
    private String password;

    private final ProjectOrchestrator orchestrator;

    public CreateAdminCommand(ProjectOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        Credentials credentials = orchestrator.provisionAdmin(project, email, password);
        ConsoleOutput.success("Admin " + credentials.adminEmail() + " provisioned for " + credentials.projectSlug());
        if (password == null) {
            ConsoleOutput.field("Password", credentials.adminPassword());
        }
    }
}
