package com.hangar.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Hangar.
 */
@Command(
        name = "hangar",
        mixinStandardHelpOptions = true,
        version = "Hangar 0.1.0",
        description = "Run and operate a fleet of PocketBase containers on one Docker host",
        subcommands = {
                CreateCommand.class,
                ListCommand.class,
                InfoCommand.class,
                StartCommand.class,
                StopCommand.class,
                RestartCommand.class,
                DeleteCommand.class,
                LogsCommand.class,
                BackupCommand.class,
                StatsCommand.class,
                UrlCommand.class,
                CredentialsCommand.class,
                CreateAdminCommand.class,
                ReconcileCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class HangarCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
