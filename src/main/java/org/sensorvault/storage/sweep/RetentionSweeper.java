package org.sensorvault.storage.sweep;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.sensorvault.storage.api.CancellationToken;
import org.sensorvault.storage.api.IStorageBackend;
import org.sensorvault.storage.api.StorageException;
import org.sensorvault.storage.file.PartitionedFileStore;
import org.sensorvault.storage.partition.PartitionId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deletes data older than the retention horizon.
 * <p>
 * For the partitioned file store whole partitions are removed, decided from the partition name
 * alone: a partition goes once its end lies strictly before {@code now - horizon}. Partitions are
 * handled one at a time; a failing one is logged and skipped. Other backends are asked to
 * {@link IStorageBackend#purgeBefore purge} rows older than the cutoff.
 * <p>
 * A zero horizon disables the sweeper.
 */
public class RetentionSweeper implements ISweeper {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

    private final IStorageBackend backend;
    private final Duration horizon;
    private final Clock clock;

    public RetentionSweeper(IStorageBackend backend, Duration horizon, Clock clock) {
        if (horizon.isNegative()) {
            throw new IllegalArgumentException("Retention horizon must not be negative: " + horizon);
        }
        this.backend = backend;
        this.horizon = horizon;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "retention";
    }

    public boolean isEnabled() {
        return !horizon.isZero();
    }

    @Override
    public SweepResult sweep(CancellationToken token) throws StorageException {
        Instant started = clock.instant();
        if (!isEnabled()) {
            log.debug("Retention disabled for '{}'", backend.getName());
            return new SweepResult(getName(), 0, 0, 0, false, Duration.ZERO);
        }
        Instant cutoff = started.minus(horizon);

        if (!(backend instanceof PartitionedFileStore)) {
            long purged = backend.purgeBefore(cutoff);
            return new SweepResult(getName(), purged, purged, 0, false, Duration.between(started, clock.instant()));
        }

        PartitionedFileStore store = (PartitionedFileStore) backend;
        long examined = 0;
        long deleted = 0;
        long failed = 0;
        boolean cancelled = false;
        for (PartitionId partition : store.listPartitions()) {
            if (token.isCancelled()) {
                cancelled = true;
                break;
            }
            examined++;
            // only partitions that ended strictly before the cutoff
            if (!partition.end().isBefore(cutoff)) {
                continue;
            }
            try {
                store.deletePartition(partition);
                deleted++;
            } catch (StorageException e) {
                failed++;
                log.error("Retention could not delete partition '{}' of '{}': {}",
                        partition, store.getName(), e.getMessage());
            }
        }
        SweepResult result = new SweepResult(getName(), examined, deleted, failed, cancelled,
                Duration.between(started, clock.instant()));
        if (deleted > 0 || failed > 0) {
            log.info("Retention sweep of '{}' (cutoff {}): {}", store.getName(), cutoff, result);
        }
        return result;
    }
}
