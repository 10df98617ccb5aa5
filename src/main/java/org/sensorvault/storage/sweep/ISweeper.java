package org.sensorvault.storage.sweep;

import org.sensorvault.storage.api.CancellationToken;
import org.sensorvault.storage.api.StorageException;

/**
 * A periodic maintenance pass over a storage backend.
 */
public interface ISweeper {

    String getName();

    /**
     * Runs one pass. Implementations check the token between partitions and stop early
     * (returning what was done so far) once it is cancelled.
     *
     * @param token cancellation signal
     * @return what the pass did
     * @throws StorageException if the backend cannot be enumerated at all
     */
    SweepResult sweep(CancellationToken token) throws StorageException;
}
