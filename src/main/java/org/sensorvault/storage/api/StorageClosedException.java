package org.sensorvault.storage.api;

/**
 * Thrown by every backend operation invoked after {@link IStorageBackend#close()}.
 * <p>
 * Use after close is a programming error, hence unchecked.
 */
public class StorageClosedException extends IllegalStateException {

    public StorageClosedException(String backendName) {
        super("Storage backend '" + backendName + "' is closed");
    }
}
