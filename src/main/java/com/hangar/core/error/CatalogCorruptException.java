package com.hangar.core.error;

/**
 * Thrown when a catalog or vault file exists but cannot be read.
 */
public class CatalogCorruptException extends HangarException {
    public CatalogCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
