package org.sensorvault.storage.sweep;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.sensorvault.storage.api.CancellationToken;
import org.sensorvault.storage.api.StorageException;
import org.sensorvault.storage.file.PartitionedFileStore;
import org.sensorvault.storage.partition.PartitionId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gzips the segments of every partition strictly older than the one receiving live writes.
 * Partitions without uncompressed segments are skipped.
 */
public class CompactionSweeper implements ISweeper {

    private static final Logger log = LoggerFactory.getLogger(CompactionSweeper.class);

    private final PartitionedFileStore store;
    private final Clock clock;

    public CompactionSweeper(PartitionedFileStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "compaction";
    }

    @Override
    public SweepResult sweep(CancellationToken token) throws StorageException {
        Instant started = clock.instant();
        if (!store.isCompressionEnabled()) {
            return new SweepResult(getName(), 0, 0, 0, false, Duration.ZERO);
        }
        PartitionId current = store.currentPartition();
        long examined = 0;
        long compressed = 0;
        long failed = 0;
        boolean cancelled = false;
        for (PartitionId partition : store.listPartitions()) {
            if (token.isCancelled()) {
                cancelled = true;
                break;
            }
            if (partition.end().isAfter(current.start())) {
                continue;
            }
            examined++;
            try {
                // late writes can add plain segments to a partition compressed earlier
                if (!store.hasUncompressedSegments(partition)) {
                    continue;
                }
                store.compressPartition(partition);
                compressed++;
            } catch (StorageException e) {
                failed++;
                log.error("Compaction of partition '{}' in '{}' failed: {}", partition, store.getName(), e.getMessage());
            }
        }
        SweepResult result = new SweepResult(getName(), examined, compressed, failed, cancelled,
                Duration.between(started, clock.instant()));
        if (compressed > 0 || failed > 0) {
            log.info("Compaction sweep of '{}': {}", store.getName(), result);
        }
        return result;
    }
}
