package com.hangar.dispatch.cli;

import com.hangar.HangarApplication;
import com.hangar.core.error.HangarException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int EXIT_FAILURE = 1;

    private final HangarCommand hangarCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(HangarCommand hangarCommand, IFactory factory) {
        this.hangarCommand = hangarCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // serve mode: the embedded web server keeps the JVM alive, picocli is skipped
        if (HangarApplication.isServeMode(args)) {
            return;
        }
        exitCode = commandLine(hangarCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Root command line with the failure handler installed: the error message
     * is printed in red and the process exits with status 1.
     */
    static CommandLine commandLine(HangarCommand root, IFactory factory) {
        var commandLine = new CommandLine(root, factory);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof HangarException) {
                log.debug("Command '{}' failed", cmd.getCommandName(), ex);
            } else {
                log.error("Command '{}' failed unexpectedly", cmd.getCommandName(), ex);
            }
            ConsoleOutput.error(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
            return EXIT_FAILURE;
        });
        return commandLine;
    }
}
