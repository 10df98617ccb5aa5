package org.sensorvault.storage;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.sensorvault.storage.api.IStorageBackend;
import org.sensorvault.storage.api.StorageClosedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Base class for storage backends: name, options, close-once lifecycle and operation counters.
 * <p>
 * Subclasses call {@link #ensureOpen()} at the start of every public operation and release
 * their resources in {@link #doClose()}, which runs exactly once. Implementation-specific
 * metrics are contributed through the {@link #addCustomMetrics(Map)} hook.
 */
public abstract class AbstractStorageBackend implements IStorageBackend {

    private static final Logger log = LoggerFactory.getLogger(AbstractStorageBackend.class);

    protected final String name;
    protected final Config options;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    protected final AtomicLong writeOperations = new AtomicLong(0);
    protected final AtomicLong readOperations = new AtomicLong(0);
    protected final AtomicLong writeErrors = new AtomicLong(0);
    protected final AtomicLong readErrors = new AtomicLong(0);

    protected AbstractStorageBackend(String name, Config options) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Storage backend name must not be empty");
        }
        this.name = name;
        this.options = options;
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * @throws StorageClosedException if {@link #close()} has been called
     */
    protected final void ensureOpen() {
        if (closed.get()) {
            throw new StorageClosedException(name);
        }
    }

    protected static void checkRange(Instant from, Instant to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("'from' (" + from + ") is after 'to' (" + to + ")");
        }
    }

    protected static void checkPage(int offset, int limit) {
        if (offset < 0) {
            throw new IllegalArgumentException("Page offset must not be negative, got " + offset);
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("Page limit must be positive, got " + limit);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public final void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            doClose();
            log.debug("Storage backend '{}' closed", name);
        } catch (Exception e) {
            log.warn("Error while closing storage backend '{}': {}", name, e.getMessage());
        }
    }

    /**
     * Releases backend resources. Called at most once.
     *
     * @throws Exception if resources cannot be released cleanly
     */
    protected abstract void doClose() throws Exception;

    /**
     * Returns a snapshot of operation counters and implementation-specific metrics.
     */
    public Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("write_operations", writeOperations.get());
        metrics.put("read_operations", readOperations.get());
        metrics.put("write_errors", writeErrors.get());
        metrics.put("read_errors", readErrors.get());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook for subclasses to add metrics. Must be cheap; called on demand.
     *
     * @param metrics mutable metric map
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
    }
}
