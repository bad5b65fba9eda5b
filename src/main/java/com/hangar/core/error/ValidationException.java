package com.hangar.core.error;

/**
 * Thrown when caller input is rejected before any state changes.
 */
public class ValidationException extends HangarException {
    public ValidationException(String message) {
        super(message);
    }
}
