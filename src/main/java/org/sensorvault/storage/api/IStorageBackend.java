package org.sensorvault.storage.api;

import java.time.Instant;
import java.util.List;

/**
 * Capability interface implemented by every reading store.
 * <p>
 * Ingestion and query collaborators depend only on this interface; the concrete backend
 * (indexed database, partitioned files, or a future remote time-series store) is chosen by
 * configuration through {@link org.sensorvault.storage.StorageBackendFactory}.
 * <p>
 * <strong>Thread Safety:</strong> all methods are safe to call concurrently from many threads,
 * for the same or for different devices. Writes to the same device are applied in submission
 * order; queries always return readings sorted by timestamp regardless of write order.
 * <p>
 * <strong>Lifecycle:</strong> after {@link #close()} every method throws
 * {@link StorageClosedException}.
 */
public interface IStorageBackend extends AutoCloseable {

    /**
     * Returns the configured name of this backend (used in logs and error messages).
     */
    String getName();

    /**
     * Persists one reading.
     * <p>
     * Never rejects a structurally valid reading for capacity reasons: file segments roll over
     * instead of failing.
     *
     * @param reading the reading to store
     * @throws StorageException         if the underlying file or database write fails
     * @throws IllegalArgumentException if the reading's device address is malformed
     */
    void write(Reading reading) throws StorageException;

    /**
     * Persists many readings.
     * <p>
     * Backends with transactions apply the whole list in one transaction; the default
     * implementation writes the readings one by one.
     *
     * @param readings readings to store, in submission order
     * @throws StorageException if a write fails (earlier readings of the list may be stored)
     */
    default void writeBatch(List<Reading> readings) throws StorageException {
        for (Reading reading : readings) {
            write(reading);
        }
    }

    /**
     * Returns the readings of a device whose timestamp lies in {@code [from, to]} (inclusive).
     * <p>
     * The result is sorted ascending by timestamp and free of duplicates. An unknown device
     * yields an empty list, never an error.
     *
     * @param deviceAddr device address
     * @param from       lower bound, {@code null} for "earliest"
     * @param to         upper bound, {@code null} for "latest"
     * @return matching readings, sorted by timestamp
     * @throws StorageException if the store cannot be read
     */
    List<Reading> query(String deviceAddr, Instant from, Instant to) throws StorageException;

    /**
     * Computes count, min/max/avg per numeric field and first/last timestamps over all stored
     * readings of a device.
     *
     * @param deviceAddr device address
     * @return the statistics; {@link DeviceStats#empty(String)} if the device has no data
     * @throws StorageException if the store cannot be read
     */
    DeviceStats stats(String deviceAddr) throws StorageException;

    /**
     * Lists every device address with at least one stored reading, sorted.
     *
     * @throws StorageException if the store cannot be read
     */
    List<String> listDevices() throws StorageException;

    /**
     * Aggregates temperature and humidity per clock hour (UTC).
     *
     * @param deviceAddr device address
     * @param from       lower bound, {@code null} for "earliest"
     * @param to         upper bound, {@code null} for "latest"
     * @return one entry per hour that contains readings, ascending
     * @throws StorageException if the store cannot be read
     */
    List<HourlyAggregate> hourlyAggregates(String deviceAddr, Instant from, Instant to) throws StorageException;

    /**
     * Returns one page of readings matching the filter, newest first (ties ordered by device
     * address and client id), together with the total number of matches.
     *
     * @param filter criteria, {@link ReadingFilter#ALL} for every reading
     * @param offset number of matches to skip, at least 0
     * @param limit  maximum page size, at least 1
     * @return the page
     * @throws StorageException         if the store cannot be read
     * @throws IllegalArgumentException if offset or limit are out of range
     */
    ReadingPage readingsPage(ReadingFilter filter, int offset, int limit) throws StorageException;

    /**
     * Returns the {@code limit} most recent readings across all devices, newest first.
     *
     * @throws StorageException if the store cannot be read
     */
    default List<Reading> latestReadings(int limit) throws StorageException {
        return readingsPage(ReadingFilter.ALL, 0, limit).readings();
    }

    /**
     * Counts stored readings.
     *
     * @param deviceAddr device to count, {@code null} for all devices
     * @return number of readings
     * @throws StorageException if the store cannot be read
     */
    long readingCount(String deviceAddr) throws StorageException;

    /**
     * Irreversibly deletes old data.
     * <p>
     * The granularity is backend specific: the partitioned file store removes whole partitions
     * whose time range ends at or before the cutoff, the indexed store deletes individual rows
     * older than the cutoff.
     *
     * @param cutoff readings older than this instant become eligible for deletion
     * @return number of deleted units (partitions or rows)
     * @throws StorageException if deletion fails
     */
    long purgeBefore(Instant cutoff) throws StorageException;

    /**
     * Releases all resources. Safe to call more than once.
     */
    @Override
    void close();
}
