package com.hangar.core.error;

/**
 * Thrown when the Docker daemon cannot be reached at all.
 */
public class RuntimeUnavailableException extends HangarException {
    public RuntimeUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
