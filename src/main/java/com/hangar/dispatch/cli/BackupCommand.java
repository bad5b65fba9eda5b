package com.hangar.dispatch.cli;

import com.hangar.core.model.BackupRecord;
import com.hangar.core.util.ByteSizes;
import com.hangar.lifecycle.ProjectOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Parameters;

/**
 * CLI command group: hangar backup create|list|restore|delete.
 * <p>
 * Create and restore stop a running project for the duration of the archive
 * operation and start it again afterwards.
 */
@Command(name = "backup", mixinStandardHelpOptions = true, description = "Manage project backups")
@Component
public class BackupCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    private final ProjectOrchestrator orchestrator;

    public BackupCommand(ProjectOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "create", mixinStandardHelpOptions = true, description = "Archive a project's data")
    void create(@Parameters(paramLabel = "PROJECT", description = "Project id or slug") String project) {
        ConsoleOutput.info("Backing up " + project + "...");
        BackupRecord backup = orchestrator.createBackup(project);
        ConsoleOutput.success("Backup " + backup.filename() + " created (" + ByteSizes.format(backup.size()) + ")");
    }

    @Command(name = "list", mixinStandardHelpOptions = true, description = "List a project's backups, newest first")
    void list(@Parameters(paramLabel = "PROJECT", description = "Project id or slug") String project) {
        var backups = orchestrator.listBackups(project);
        if (backups.isEmpty()) {
            ConsoleOutput.info("No backups for " + project);
            return;
        }
        for (BackupRecord backup : backups) {
            System.out.println(String.format("  %-50s %10s  %s",
                    backup.filename(), ByteSizes.format(backup.size()), backup.createdAt()));
        }
    }

    @Command(name = "restore", mixinStandardHelpOptions = true,
            description = "Replace a project's data with a backup")
    void restore(@Parameters(index = "0", paramLabel = "PROJECT", description = "Project id or slug") String project,
                 @Parameters(index = "1", paramLabel = "BACKUP", description = "Backup filename") String backup) {
        ConsoleOutput.info("Restoring " + backup + " into " + project + "...");
        var restored = orchestrator.restoreBackup(project, backup);
        ConsoleOutput.success("Backup restored (" + ConsoleOutput.status(restored.getStatus()) + ")");
    }

    @Command(name = "delete", mixinStandardHelpOptions = true, description = "Delete a backup archive")
    void delete(@Parameters(index = "0", paramLabel = "PROJECT", description = "Project id or slug") String project,
                @Parameters(index = "1", paramLabel = "BACKUP", description = "Backup filename") String backup) {
        orchestrator.deleteBackup(project, backup);
        ConsoleOutput.success("Backup " + backup + " deleted");
    }
}
