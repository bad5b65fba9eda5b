package com.hangar.core.error;

/**
 * Thrown when the daemon was reachable but a container operation failed.
 */
public class ContainerOperationException extends HangarException {

    private final String containerName;

    public ContainerOperationException(String containerName, String message) {
        super(message);
        this.containerName = containerName;
    }

    public ContainerOperationException(String containerName, String message, Throwable cause) {
        super(message, cause);
        this.containerName = containerName;
    }

    public String getContainerName() {
        return containerName;
    }
}
