package org.sensorvault.storage.api;

/**
 * Thrown when a storage operation fails because of an underlying I/O or database error.
 */
public class StorageException extends Exception {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
