package com.hangar.dispatch.cli;

import com.hangar.core.error.StorageException;
import com.hangar.core.model.Credentials;
import com.hangar.lifecycle.ProjectOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CLI command group: hangar credentials show|export.
 */
@Command(name = "credentials", aliases = "creds", mixinStandardHelpOptions = true,
        description = "Show or export admin credentials")
@Component
public class CredentialsCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    private final ProjectOrchestrator orchestrator;

    public CredentialsCommand(ProjectOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "show", mixinStandardHelpOptions = true, description = "Show one project's admin credentials")
    void show(@Parameters(paramLabel = "PROJECT", description = "Project id or slug") String project) {
        Credentials credentials = orchestrator.credentials(project);
        System.out.println();
        System.out.println("CREDENTIALS " + credentials.projectName());
        ConsoleOutput.field("Project ID", credentials.projectId());
        ConsoleOutput.field("Admin URL", orchestrator.resolveAdminUrl(project));
        ConsoleOutput.field("Email", credentials.adminEmail());
        ConsoleOutput.field("Password", credentials.adminPassword());
        ConsoleOutput.field("Created", credentials.createdAt());
    }

    @Command(name = "export", mixinStandardHelpOptions = true,
            description = "Write every project's credentials as a text report")
    void export(@Option(names = {"--output", "-o"}, description = "File to write (default: standard output)")
                Path output) {
        String report = orchestrator.exportCredentials();
        if (output == null) {
            System.out.print(report);
            System.out.flush();
            return;
        }
        try {
            Files.writeString(output, report, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Cannot write credentials report to " + output, e);
        }
        ConsoleOutput.success("Credentials written to " + output);
        ConsoleOutput.warn("The file contains plaintext passwords");
    }
}
