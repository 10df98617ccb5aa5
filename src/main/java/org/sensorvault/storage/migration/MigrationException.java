package org.sensorvault.storage.migration;

/**
 * Fatal failure of a migration run, located at the chunk that could not be written.
 * <p>
 * Chunks committed before the failure stay in the destination; a later run overwrites them
 * instead of duplicating them.
 */
public class MigrationException extends Exception {

    private final String partition;
    private final String deviceAddr;
    private final int chunkIndex;
    private final String lastSuccessfulChunk;

    public MigrationException(String message, String partition, String deviceAddr, int chunkIndex,
                              String lastSuccessfulChunk, Throwable cause) {
        super(message, cause);
        this.partition = partition;
        this.deviceAddr = deviceAddr;
        this.chunkIndex = chunkIndex;
        this.lastSuccessfulChunk = lastSuccessfulChunk;
    }

    public MigrationException(String message, Throwable cause) {
        this(message, null, null, -1, null, cause);
    }

    /**
     * Partition of the failing chunk, {@code null} if the failure is not tied to a chunk.
     */
    public String getPartition() {
        return partition;
    }

    public String getDeviceAddr() {
        return deviceAddr;
    }

    /**
     * Index of the failing chunk within its segment, {@code -1} if not tied to a chunk.
     */
    public int getChunkIndex() {
        return chunkIndex;
    }

    /**
     * Description ({@code partition/device#chunk}) of the last committed chunk, or {@code null}
     * if none was committed.
     */
    public String getLastSuccessfulChunk() {
        return lastSuccessfulChunk;
    }
}
