package com.hangar.core.error;

/**
 * Base type for every failure Hangar reports to its callers.
 */
public abstract class HangarException extends RuntimeException {

    protected HangarException(String message) {
        super(message);
    }

    protected HangarException(String message, Throwable cause) {
        super(message, cause);
    }
}
