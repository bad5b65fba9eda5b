package com.hangar.core.error;

/**
 * Thrown when a request collides with existing state: a slug already in use,
 * or a lifecycle operation against a deleted project.
 */
public class ConflictException extends HangarException {
    public ConflictException(String message) {
        super(message);
    }
}
