package com.hangar.core.error;

/**
 * Thrown when a command run inside a container exits non-zero.
 */
public class ExecFailedException extends ContainerOperationException {

    private final long exitCode;
    private final String output;

    public ExecFailedException(String containerName, long exitCode, String output) {
        super(containerName, "Command in " + containerName + " exited with code " + exitCode);
        this.exitCode = exitCode;
        this.output = output;
    }

    public long getExitCode() {
        return exitCode;
    }

    public String getOutput() {
        return output;
    }
}
