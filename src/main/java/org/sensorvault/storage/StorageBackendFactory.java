package org.sensorvault.storage;

import java.time.Clock;

import org.sensorvault.storage.api.IStorageBackend;
import org.sensorvault.storage.database.H2ReadingStore;
import org.sensorvault.storage.file.PartitionedFileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Creates storage backends from the {@code storage} configuration block.
 * <p>
 * {@code storage.backend} selects the implementation ({@value #PARTITIONED_FILE} or
 * {@value #INDEXED}); each implementation reads its options from the sub-block of the same
 * purpose ({@code storage.file}, {@code storage.indexed}).
 */
public final class StorageBackendFactory {

    private static final Logger log = LoggerFactory.getLogger(StorageBackendFactory.class);

    public static final String PARTITIONED_FILE = "partitioned-file";
    public static final String INDEXED = "indexed";

    private StorageBackendFactory() {
    }

    /**
     * Creates the backend selected by {@code storage.backend}.
     *
     * @param storage the {@code storage} block
     * @return a new, open backend
     * @throws IllegalArgumentException for an unknown backend name
     */
    public static IStorageBackend create(Config storage) {
        String backend = storage.hasPath("backend") ? storage.getString("backend") : PARTITIONED_FILE;
        switch (backend) {
            case PARTITIONED_FILE:
                return createFileStore(storage, Clock.systemUTC());
            case INDEXED:
                return createIndexedStore(storage);
            default:
                throw new IllegalArgumentException("Unknown storage backend '" + backend
                        + "', expected '" + PARTITIONED_FILE + "' or '" + INDEXED + "'");
        }
    }

    public static PartitionedFileStore createFileStore(Config storage, Clock clock) {
        Config options = storage.hasPath("file") ? storage.getConfig("file") : ConfigFactory.empty();
        log.debug("Creating partitioned file store from {}", options.origin().description());
        return new PartitionedFileStore("file-store", options, clock);
    }

    public static H2ReadingStore createIndexedStore(Config storage) {
        Config options = storage.hasPath("indexed") ? storage.getConfig("indexed") : ConfigFactory.empty();
        log.debug("Creating indexed store from {}", options.origin().description());
        return new H2ReadingStore("indexed-store", options);
    }
}
