package org.sensorvault.storage.migration;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;

import org.sensorvault.storage.api.CancellationToken;
import org.sensorvault.storage.api.DeviceAddresses;
import org.sensorvault.storage.api.IStorageBackend;
import org.sensorvault.storage.api.Reading;
import org.sensorvault.storage.api.StorageException;
import org.sensorvault.storage.file.DeviceSegment;
import org.sensorvault.storage.file.PartitionedFileStore;
import org.sensorvault.storage.file.ReadingCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Copies every reading of a partitioned file store into another backend and verifies the result.
 * <p>
 * The run moves through {@link MigrationState#SCANNING}, {@link MigrationState#COPYING} and
 * {@link MigrationState#VERIFYING} to {@link MigrationState#SUCCEEDED}. Each phase can be called
 * on its own, in that order, or all at once through {@link #run(CancellationToken)}. A fatal
 * error in any phase moves the coordinator to {@link MigrationState#FAILED}.
 * <p>
 * The source is only read. Destination writes are chunked; chunks committed before a failure
 * remain, and because the destination upserts on {@code (device_addr, timestamp, client_id)}
 * a repeated run completes a partial one without duplicates.
 * <p>
 * Configuration:
 * <pre>
 * chunkSize = 1000
 * checksum = true
 * </pre>
 * <p>
 * <strong>Thread Safety:</strong> a coordinator is single-use and driven by one thread.
 */
public class MigrationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MigrationCoordinator.class);

    private final PartitionedFileStore source;
    private final IStorageBackend destination;
    private final int chunkSize;
    private final boolean checksum;
    private final Clock clock;

    private final AtomicReference<MigrationState> state = new AtomicReference<>(MigrationState.PENDING);
    private final List<SourceBatch> batches = new ArrayList<>();
    private final List<DeviceMismatch> mismatches = new ArrayList<>();
    private Instant startedAt;
    private Instant finishedAt;
    private long segmentsSkipped;
    private long readingsScanned;
    private long readingsCopied;
    private long chunksCommitted;
    private MigrationException failure;

    public MigrationCoordinator(PartitionedFileStore source, IStorageBackend destination, Config options) {
        this(source, destination, options, Clock.systemUTC());
    }

    public MigrationCoordinator(PartitionedFileStore source, IStorageBackend destination, Config options,
                                Clock clock) {
        this.source = source;
        this.destination = destination;
        this.chunkSize = options.hasPath("chunkSize") ? options.getInt("chunkSize") : 1000;
        this.checksum = !options.hasPath("checksum") || options.getBoolean("checksum");
        this.clock = clock;
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Migration chunkSize must be positive, got " + chunkSize);
        }
    }

    public MigrationState getState() {
        return state.get();
    }

    /**
     * Runs all phases and returns the report. Never throws for migration failures; they are
     * carried in {@link MigrationReport#failure()}.
     */
    public MigrationReport run(CancellationToken token) {
        try {
            scan(token);
            copy(token);
            verify(token);
        } catch (MigrationException e) {
            log.error("Migration from '{}' to '{}' failed: {}", source.getName(), destination.getName(), e.getMessage());
        }
        return report();
    }

    // ========================================================================
    // Phases
    // ========================================================================

    /**
     * Decodes every segment of the source, compressed ones included. Unreadable segments are
     * logged and skipped.
     *
     * @return the decoded batches in partition, device, segment order
     * @throws MigrationException if the source cannot be enumerated or the run is cancelled
     * @throws IllegalStateException if not in {@link MigrationState#PENDING}
     */
    public List<SourceBatch> scan(CancellationToken token) throws MigrationException {
        transition(MigrationState.PENDING, MigrationState.SCANNING);
        startedAt = clock.instant();
        log.info("Migration scanning source '{}'", source.getName());
        try {
            for (DeviceSegment segment : source.scanSegments()) {
                token.throwIfCancelled("Migration scan");
                try {
                    List<Reading> readings = source.readSegment(segment);
                    batches.add(new SourceBatch(segment, readings));
                    readingsScanned += readings.size();
                } catch (IOException e) {
                    segmentsSkipped++;
                    log.warn("Skipping unreadable source segment {}: {}", segment, e.getMessage());
                }
            }
        } catch (StorageException e) {
            throw fail(new MigrationException("Cannot enumerate source segments: " + e.getMessage(), e));
        } catch (CancellationException e) {
            throw fail(new MigrationException("Migration cancelled while scanning", e));
        }
        log.info("Migration scanned {} segment(s), {} reading(s), {} skipped",
                batches.size(), readingsScanned, segmentsSkipped);
        return List.copyOf(batches);
    }

    /**
     * Writes the scanned batches to the destination in chunks of {@code chunkSize} readings.
     * Chunks are numbered per partition and device, continuing across the device's segments.
     *
     * @return number of readings written
     * @throws MigrationException on the first chunk that cannot be written, or on cancellation
     * @throws IllegalStateException if {@link #scan} has not completed
     */
    public long copy(CancellationToken token) throws MigrationException {
        transition(MigrationState.SCANNING, MigrationState.COPYING);
        String lastChunk = null;
        Map<String, Integer> nextChunk = new HashMap<>();
        for (SourceBatch batch : batches) {
            List<Reading> readings = batch.readings();
            String device = DeviceAddresses.canonical(batch.segment().deviceId());
            String key = batch.partitionName() + "/" + device;
            for (int offset = 0; offset < readings.size(); offset += chunkSize) {
                int chunkIndex = nextChunk.getOrDefault(key, 0);
                try {
                    token.throwIfCancelled("Migration copy");
                } catch (CancellationException e) {
                    throw fail(new MigrationException("Migration cancelled while copying; last committed chunk: "
                            + (lastChunk == null ? "none" : lastChunk),
                            batch.partitionName(), device, chunkIndex, lastChunk, e));
                }
                List<Reading> chunk = readings.subList(offset, Math.min(offset + chunkSize, readings.size()));
                try {
                    destination.writeBatch(chunk);
                } catch (StorageException | RuntimeException e) {
                    throw fail(new MigrationException(String.format(
                            "Chunk %d of device %s in partition %s (%s) failed: %s; last committed chunk: %s",
                            chunkIndex, device, batch.partitionName(), batch.segment().path().getFileName(),
                            e.getMessage(), lastChunk == null ? "none" : lastChunk),
                            batch.partitionName(), device, chunkIndex, lastChunk, e));
                }
                readingsCopied += chunk.size();
                chunksCommitted++;
                nextChunk.put(key, chunkIndex + 1);
                lastChunk = key + "#" + chunkIndex;
            }
        }
        log.info("Migration copied {} reading(s) in {} chunk(s) to '{}'",
                readingsCopied, chunksCommitted, destination.getName());
        return readingsCopied;
    }

    /**
     * Compares per-device counts, and content checksums when enabled, between the scanned
     * source and the destination. Differences are reported, not fatal: the coordinator still
     * ends in {@link MigrationState#SUCCEEDED}.
     *
     * @return the differences, empty when source and destination agree
     * @throws MigrationException if the destination cannot be read or the run is cancelled
     * @throws IllegalStateException if {@link #copy} has not completed
     */
    public List<DeviceMismatch> verify(CancellationToken token) throws MigrationException {
        transition(MigrationState.COPYING, MigrationState.VERIFYING);
        Map<String, Collection<Reading>> sourceByDevice = distinctSourceReadings();
        try {
            for (Map.Entry<String, Collection<Reading>> entry : sourceByDevice.entrySet()) {
                token.throwIfCancelled("Migration verify");
                String device = entry.getKey();
                long sourceCount = entry.getValue().size();
                long destinationCount = destination.stats(device).count();
                if (sourceCount != destinationCount) {
                    mismatches.add(new DeviceMismatch(device, sourceCount, destinationCount, null, null));
                    continue;
                }
                if (checksum) {
                    String sourceSum = checksum(entry.getValue());
                    String destinationSum = checksum(destination.query(device, null, null));
                    if (!sourceSum.equals(destinationSum)) {
                        mismatches.add(new DeviceMismatch(device, sourceCount, destinationCount, sourceSum, destinationSum));
                    }
                }
            }
        } catch (StorageException e) {
            throw fail(new MigrationException("Cannot read destination during verification: " + e.getMessage(), e));
        } catch (CancellationException e) {
            throw fail(new MigrationException("Migration cancelled while verifying", e));
        }

        if (mismatches.isEmpty()) {
            log.info("Migration verified {} device(s) without differences", sourceByDevice.size());
        } else {
            for (DeviceMismatch mismatch : mismatches) {
                log.warn("Migration verification mismatch: {}", mismatch);
            }
        }
        finishedAt = clock.instant();
        transition(MigrationState.VERIFYING, MigrationState.SUCCEEDED);
        return List.copyOf(mismatches);
    }

    /**
     * Returns the current progress, or the final outcome once the run is terminal.
     */
    public MigrationReport report() {
        Instant end = finishedAt != null ? finishedAt : clock.instant();
        Duration elapsed = startedAt == null ? Duration.ZERO : Duration.between(startedAt, end);
        return new MigrationReport(state.get(), batches.size(), segmentsSkipped, readingsScanned,
                readingsCopied, chunksCommitted, mismatches, failure, elapsed);
    }

    // ========================================================================
    // Internals
    // ========================================================================

    /**
     * Groups source readings by device, keeping the last reading per
     * {@code (timestamp, client_id)} exactly as the destination's upsert does.
     */
    private Map<String, Collection<Reading>> distinctSourceReadings() {
        Map<String, Map<String, Reading>> byDevice = new TreeMap<>();
        for (SourceBatch batch : batches) {
            for (Reading reading : batch.readings()) {
                byDevice.computeIfAbsent(reading.deviceAddr(), d -> new LinkedHashMap<>())
                        .put(reading.timestamp() + "|" + reading.clientId(), reading);
            }
        }
        Map<String, Collection<Reading>> result = new LinkedHashMap<>();
        byDevice.forEach((device, readings) -> result.put(device, readings.values()));
        return result;
    }

    private static String checksum(Collection<Reading> readings) {
        List<Reading> sorted = new ArrayList<>(readings);
        sorted.sort(Comparator.comparing(Reading::timestamp).thenComparing(Reading::clientId));
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        for (Reading reading : sorted) {
            digest.update(ReadingCodec.encode(reading).getBytes(StandardCharsets.UTF_8));
            digest.update((byte) '\n');
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private void transition(MigrationState expected, MigrationState next) {
        if (!state.compareAndSet(expected, next)) {
            throw new IllegalStateException(String.format("Cannot enter migration phase %s from state %s (expected %s)",
                    next, state.get(), expected));
        }
    }

    private MigrationException fail(MigrationException e) {
        failure = e;
        finishedAt = clock.instant();
        state.set(MigrationState.FAILED);
        return e;
    }
}
