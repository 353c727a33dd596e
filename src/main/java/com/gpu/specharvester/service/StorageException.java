package com.gpu.specharvester.service;

/**
 * A storage operation failed and its transaction was rolled back.
 * Carries the identity of the unit of work so callers can log it and move on.
 */
public class StorageException extends RuntimeException {

    private final String unit;

    public StorageException(String unit, String message) {
        super("Storage failure for " + unit + ": " + message);
        this.unit = unit;
    }

    public StorageException(String unit, Throwable cause) {
        super("Storage failure for " + unit + ": " + cause.getMessage(), cause);
        this.unit = unit;
    }

    public String getUnit() {
        return unit;
    }
}
