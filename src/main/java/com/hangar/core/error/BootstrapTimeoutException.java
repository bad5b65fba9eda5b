package com.hangar.core.error;

/**
 * Raised when the admin bootstrap retry budget runs out. Never escapes project
 * creation; the orchestrator logs it and carries on.
 */
public class BootstrapTimeoutException extends HangarException {

    private final int attempts;

    public BootstrapTimeoutException(String containerName, int attempts, Throwable lastFailure) {
        super("Admin bootstrap for " + containerName + " failed after " + attempts + " attempts", lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
