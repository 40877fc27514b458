package com.sensorpipeline.core.buffer;

/**
 * Signals that a bulk insert failed and nothing from the batch was stored.
 */
public class StorageException extends Exception {

    private static final long serialVersionUID = 1L;

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
