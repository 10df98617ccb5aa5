package org.sensorvault.storage.file;

import java.io.BufferedInputStream;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.sensorvault.storage.AbstractStorageBackend;
import org.sensorvault.storage.api.DeviceAddresses;
import org.sensorvault.storage.api.DeviceStats;
import org.sensorvault.storage.api.HourlyAggregate;
import org.sensorvault.storage.api.Reading;
import org.sensorvault.storage.api.ReadingFilter;
import org.sensorvault.storage.api.ReadingPage;
import org.sensorvault.storage.api.StorageException;
import org.sensorvault.storage.compression.CompressionCodecFactory;
import org.sensorvault.storage.compression.ICompressionCodec;
import org.sensorvault.storage.partition.PartitionId;
import org.sensorvault.storage.partition.PartitionResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Legacy storage backend: one directory per time partition, one or more JSON-lines segment files
 * per device inside it.
 * <p>
 * Layout: {@code <rootDirectory>/<partition-id>/readings_<device-id>[.<n>].json[.gz]}.
 * Segments are capped at {@code maxReadingsPerFile} readings and roll over to the next index
 * when full. Sealed partitions are gzip-compressed in place by {@link #compressPartition}.
 * <p>
 * <strong>Concurrency:</strong> every (partition, device) pair has its own
 * {@link ReentrantReadWriteLock}. Appends and compression take the write lock, reads take the
 * read lock. Writers of different devices never block each other. Locks exist only for pairs that
 * have segments on disk or are being written; deleting a partition drops its locks.
 * <p>
 * Device addresses are stored and matched in their canonical form
 * ({@link DeviceAddresses#canonical(String)}).
 * <p>
 * Configuration:
 * <pre>
 * rootDirectory = "data/readings"
 * partitionInterval = 30d
 * maxReadingsPerFile = 1000
 * timeZone = "UTC"
 * compression { enabled = true }
 * </pre>
 */
public class PartitionedFileStore extends AbstractStorageBackend {

    private static final Logger log = LoggerFactory.getLogger(PartitionedFileStore.class);

    static final String COMPRESSED_MARKER = ".compressed";
    private static final String TEMP_SUFFIX = ".tmp";

    private static final Comparator<Reading> NEWEST_FIRST = Comparator.comparing(Reading::timestamp).reversed()
            .thenComparing(Reading::deviceAddr)
            .thenComparing(Reading::clientId);

    private final Path rootDirectory;
    private final PartitionResolver resolver;
    private final int maxReadingsPerFile;
    private final ICompressionCodec codec;
    private final Clock clock;

    private final Map<String, DeviceSlot> slots = new ConcurrentHashMap<>();

    public PartitionedFileStore(String name, Config options) {
        this(name, options, Clock.systemUTC());
    }

    public PartitionedFileStore(String name, Config options, Clock clock) {
        super(name, options);
        if (!options.hasPath("rootDirectory")) {
            throw new IllegalArgumentException("Storage '" + name + "' requires 'rootDirectory'");
        }
        this.rootDirectory = Path.of(options.getString("rootDirectory")).toAbsolutePath().normalize();
        Duration interval = options.hasPath("partitionInterval")
                ? options.getDuration("partitionInterval")
                : Duration.ofDays(30);
        ZoneId zone = options.hasPath("timeZone") ? ZoneId.of(options.getString("timeZone")) : ZoneOffset.UTC;
        this.resolver = new PartitionResolver(interval, zone);
        this.maxReadingsPerFile = options.hasPath("maxReadingsPerFile") ? options.getInt("maxReadingsPerFile") : 1000;
        if (maxReadingsPerFile <= 0) {
            throw new IllegalArgumentException("maxReadingsPerFile must be positive, got " + maxReadingsPerFile);
        }
        this.codec = CompressionCodecFactory.create(options);
        this.clock = clock;

        try {
            Files.createDirectories(rootDirectory);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create root directory for storage '" + name + "': "
                    + rootDirectory, e);
        }
        log.debug("Partitioned file store '{}' at {} ({} partitions, {} readings/file, codec={})",
                name, rootDirectory, resolver.getGranularity(), maxReadingsPerFile, codec.getName());
    }

    // ========================================================================
    // IStorageBackend
    // ========================================================================

    @Override
    public void write(Reading reading) throws StorageException {
        writeBatch(List.of(requireReading(reading)));
    }

    /**
     * Appends readings grouped by (partition, device). Readings of one device keep their
     * submission order within the segment files.
     */
    @Override
    public void writeBatch(List<Reading> readings) throws StorageException {
        ensureOpen();
        Map<String, List<Reading>> groups = new LinkedHashMap<>();
        Map<String, PartitionId> partitions = new LinkedHashMap<>();
        for (Reading submitted : readings) {
            Reading reading = DeviceAddresses.canonical(submitted);
            String fileId = DeviceAddresses.toFileId(reading.deviceAddr());
            PartitionId partition = resolver.resolve(reading.timestamp());
            String key = slotKey(partition, fileId);
            partitions.putIfAbsent(key, partition);
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(reading);
        }

        for (Map.Entry<String, List<Reading>> group : groups.entrySet()) {
            PartitionId partition = partitions.get(group.getKey());
            DeviceSlot slot = acquire(partition, fileIdOf(group.getKey()), true);
            try {
                appendLocked(slot, group.getValue());
                writeOperations.addAndGet(group.getValue().size());
            } catch (IOException e) {
                writeErrors.incrementAndGet();
                slot.initialized = false;
                throw new StorageException("Failed to append " + group.getValue().size() + " reading(s) to "
                        + partition.name() + "/" + slot.fileId + " in storage '" + name + "'", e);
            } finally {
                release(slot, true);
            }
        }
    }

    @Override
    public List<Reading> query(String deviceAddr, Instant from, Instant to) throws StorageException {
        ensureOpen();
        checkRange(from, to);
        String addr = DeviceAddresses.canonical(deviceAddr);
        List<Reading> matches = collect(new ReadingFilter(addr, null, from, to));
        readOperations.incrementAndGet();
        matches.sort(Comparator.comparing(Reading::timestamp));
        return matches;
    }

    @Override
    public DeviceStats stats(String deviceAddr) throws StorageException {
        return DeviceStats.of(DeviceAddresses.canonical(deviceAddr), query(deviceAddr, null, null));
    }

    @Override
    public List<HourlyAggregate> hourlyAggregates(String deviceAddr, Instant from, Instant to)
            throws StorageException {
        return HourlyAggregate.of(DeviceAddresses.canonical(deviceAddr), query(deviceAddr, from, to));
    }

    /**
     * Decodes every matching segment; cost grows with the amount of stored data.
     */
    @Override
    public ReadingPage readingsPage(ReadingFilter filter, int offset, int limit) throws StorageException {
        ensureOpen();
        checkPage(offset, limit);
        List<Reading> matches = collect(filter == null ? ReadingFilter.ALL : filter);
        readOperations.incrementAndGet();
        matches.sort(NEWEST_FIRST);
        int from = Math.min(offset, matches.size());
        int to = Math.min(from + limit, matches.size());
        return new ReadingPage(matches.subList(from, to), matches.size(), offset, limit);
    }

    @Override
    public long readingCount(String deviceAddr) throws StorageException {
        ensureOpen();
        ReadingFilter filter = deviceAddr == null ? ReadingFilter.ALL : ReadingFilter.device(deviceAddr);
        long count = collect(filter).size();
        readOperations.incrementAndGet();
        return count;
    }

    @Override
    public List<String> listDevices() throws StorageException {
        ensureOpen();
        Set<String> devices = new TreeSet<>();
        for (DeviceSegment segment : scanSegments()) {
            devices.add(DeviceAddresses.canonical(segment.deviceId()));
        }
        readOperations.incrementAndGet();
        return new ArrayList<>(devices);
    }

    /**
     * Deletes every partition whose range ends at or before the cutoff.
     * <p>
     * A partition that cannot be deleted is logged and skipped; the remaining ones are still
     * processed.
     *
     * @return number of deleted partitions
     */
    @Override
    public long purgeBefore(Instant cutoff) throws StorageException {
        ensureOpen();
        long deleted = 0;
        for (PartitionId partition : listPartitions()) {
            if (partition.end().isAfter(cutoff)) {
                continue;
            }
            try {
                deletePartition(partition);
                deleted++;
            } catch (StorageException e) {
                log.error("Failed to delete partition '{}' of storage '{}': {}", partition, name, e.getMessage());
            }
        }
        return deleted;
    }

    @Override
    protected void doClose() {
        slots.clear();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        try (Stream<Path> files = Files.walk(rootDirectory)) {
            long bytes = files.filter(Files::isRegularFile).mapToLong(PartitionedFileStore::sizeOf).sum();
            metrics.put("disk_bytes", bytes);
        } catch (IOException e) {
            log.debug("Cannot compute disk usage of {}: {}", rootDirectory, e.getMessage());
        }
        metrics.put("open_slots", slots.size());
    }

    // ========================================================================
    // Partition management (used by sweepers and migration)
    // ========================================================================

    public Path getRootDirectory() {
        return rootDirectory;
    }

    public PartitionResolver getResolver() {
        return resolver;
    }

    public boolean isCompressionEnabled() {
        return !codec.getFileExtension().isEmpty();
    }

    /**
     * Returns the partition that currently receives live writes.
     */
    public PartitionId currentPartition() {
        return resolver.resolve(clock.instant());
    }

    /**
     * Lists existing partition directories in time order. Directories whose names are not
     * partition identifiers are ignored.
     */
    public List<PartitionId> listPartitions() throws StorageException {
        if (!Files.isDirectory(rootDirectory)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(rootDirectory)) {
            return entries.filter(Files::isDirectory)
                    .map(dir -> resolver.parse(dir.getFileName().toString()))
                    .flatMap(Optional::stream)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("Failed to list partitions of storage '" + name + "'", e);
        }
    }

    /**
     * Lists every segment of every partition, ordered by partition, device and segment index.
     */
    public List<DeviceSegment> scanSegments() throws StorageException {
        List<DeviceSegment> segments = new ArrayList<>();
        for (PartitionId partition : listPartitions()) {
            segments.addAll(listSegments(partition));
        }
        return segments;
    }

    /**
     * Lists the segments of one partition, ordered by device and segment index.
     */
    public List<DeviceSegment> listSegments(PartitionId partition) throws StorageException {
        Path dir = partitionDirectory(partition);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(Files::isRegularFile)
                    .map(file -> DeviceSegment.parse(partition, file))
                    .flatMap(Optional::stream)
                    .sorted(Comparator.comparing(DeviceSegment::deviceId)
                            .thenComparingInt(DeviceSegment::index)
                            .thenComparing(DeviceSegment::compressed))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("Failed to list segments of partition '" + partition + "'", e);
        }
    }

    /**
     * Decodes one segment under the device's read lock. A segment compressed since it was listed
     * is read from its compressed file.
     *
     * @throws IOException if the segment is gone, truncated or contains a malformed line
     */
    public List<Reading> readSegment(DeviceSegment segment) throws IOException {
        DeviceSlot slot = acquire(segment.partition(), segment.deviceId(), false);
        try {
            return decode(currentPath(segment));
        } finally {
            release(slot, false);
        }
    }

    /**
     * Returns whether the partition carries the compressed marker. Writes that open a new
     * segment in a marked partition remove the marker.
     */
    public boolean isCompressed(PartitionId partition) {
        return Files.exists(partitionDirectory(partition).resolve(COMPRESSED_MARKER));
    }

    public boolean hasUncompressedSegments(PartitionId partition) throws StorageException {
        return listSegments(partition).stream().anyMatch(segment -> !segment.compressed());
    }

    /**
     * Gzips every uncompressed segment of a partition and marks the partition as compressed.
     * <p>
     * Each segment is written to a temporary file, atomically moved next to the original and
     * only then is the original removed, all under the device's write lock. Segments that are
     * already compressed are left alone, so the call can be repeated after late writes.
     *
     * @param partition the partition to compress
     * @return number of segments compressed by this call
     * @throws StorageException if a segment cannot be compressed
     */
    public int compressPartition(PartitionId partition) throws StorageException {
        ensureOpen();
        if (!isCompressionEnabled()) {
            log.debug("Compression disabled for storage '{}', skipping partition '{}'", name, partition);
            return 0;
        }
        int compressed = 0;
        for (DeviceSegment segment : listSegments(partition)) {
            if (segment.compressed()) {
                continue;
            }
            DeviceSlot slot = acquire(partition, segment.deviceId(), true);
            try {
                if (Files.exists(segment.path())) {
                    compressSegment(segment.path());
                    compressed++;
                }
                slot.initialized = false;
            } catch (IOException e) {
                throw new StorageException("Failed to compress segment " + segment + " of storage '" + name + "'", e);
            } finally {
                release(slot, true);
            }
        }
        try {
            Path marker = partitionDirectory(partition).resolve(COMPRESSED_MARKER);
            if (Files.isDirectory(marker.getParent()) && !Files.exists(marker) && !hasUncompressedSegments(partition)) {
                Files.createFile(marker);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to mark partition '" + partition + "' as compressed", e);
        }
        if (compressed > 0) {
            log.debug("Compressed {} segment(s) of partition '{}' in storage '{}'", compressed, partition, name);
        }
        return compressed;
    }

    /**
     * Removes a partition directory with all its segments and drops the partition's locks.
     *
     * @throws StorageException if a file cannot be deleted
     */
    public void deletePartition(PartitionId partition) throws StorageException {
        Path dir = partitionDirectory(partition);
        Set<String> fileIds = new TreeSet<>();
        for (DeviceSegment segment : listSegments(partition)) {
            fileIds.add(segment.deviceId());
        }
        String prefix = partition.name() + "/";
        for (String key : slots.keySet()) {
            if (key.startsWith(prefix)) {
                fileIds.add(fileIdOf(key));
            }
        }
        for (String fileId : fileIds) {
            DeviceSlot slot = acquire(partition, fileId, true);
            try {
                for (DeviceSegment segment : segmentsOf(partition, fileId)) {
                    Files.deleteIfExists(segment.path());
                }
            } catch (IOException e) {
                throw new StorageException("Failed to delete segments of " + partition.name() + "/" + fileId, e);
            } finally {
                slot.retired = true;
                slots.remove(slotKey(partition, fileId), slot);
                release(slot, true);
            }
        }
        if (!Files.isDirectory(dir)) {
            return;
        }
        try (Stream<Path> leftovers = Files.list(dir)) {
            for (Path file : (Iterable<Path>) leftovers::iterator) {
                Files.deleteIfExists(file);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to clean partition directory " + dir, e);
        }
        try {
            Files.deleteIfExists(dir);
        } catch (IOException e) {
            throw new StorageException("Failed to delete partition directory " + dir, e);
        }
        log.info("Deleted partition '{}' of storage '{}'", partition, name);
    }

    // ========================================================================
    // Internals
    // ========================================================================

    /**
     * Reads all readings matching the filter from the overlapping partitions, without duplicates.
     */
    private List<Reading> collect(ReadingFilter filter) throws StorageException {
        String fileId = filter.deviceAddr() == null ? null : DeviceAddresses.toFileId(filter.deviceAddr());
        Set<Reading> matches = new LinkedHashSet<>();
        for (PartitionId partition : listPartitions()) {
            if (!partition.overlaps(filter.from(), filter.to())) {
                continue;
            }
            if (Thread.currentThread().isInterrupted()) {
                throw new StorageException("Read of storage '" + name + "' interrupted");
            }
            Set<String> fileIds = new TreeSet<>();
            if (fileId != null) {
                fileIds.add(fileId);
            } else {
                for (DeviceSegment segment : listSegments(partition)) {
                    fileIds.add(segment.deviceId());
                }
            }
            for (String id : fileIds) {
                matches.addAll(readDevice(partition, id, filter));
            }
        }
        return new ArrayList<>(matches);
    }

    private List<Reading> readDevice(PartitionId partition, String fileId, ReadingFilter filter)
            throws StorageException {
        // no lock for devices without data in this partition
        if (segmentsOf(partition, fileId).isEmpty()) {
            return List.of();
        }
        List<Reading> result = new ArrayList<>();
        DeviceSlot slot = acquire(partition, fileId, false);
        try {
            for (DeviceSegment segment : segmentsOf(partition, fileId)) {
                List<Reading> readings;
                try {
                    readings = decode(segment.path());
                } catch (IOException e) {
                    readErrors.incrementAndGet();
                    log.warn("Skipping unreadable segment {} of storage '{}': {}", segment, name, e.getMessage());
                    continue;
                }
                for (Reading reading : readings) {
                    if (filter.matches(reading)) {
                        result.add(reading);
                    }
                }
            }
        } finally {
            release(slot, false);
        }
        return result;
    }

    private List<DeviceSegment> segmentsOf(PartitionId partition, String fileId) throws StorageException {
        List<DeviceSegment> segments = new ArrayList<>();
        for (DeviceSegment segment : listSegments(partition)) {
            if (segment.deviceId().equals(fileId)) {
                segments.add(segment);
            }
        }
        return segments;
    }

    private static Path currentPath(DeviceSegment segment) throws IOException {
        if (Files.exists(segment.path())) {
            return segment.path();
        }
        try (Stream<Path> entries = Files.list(segment.path().getParent())) {
            return entries.map(file -> DeviceSegment.parse(segment.partition(), file))
                    .flatMap(Optional::stream)
                    .filter(s -> s.deviceId().equals(segment.deviceId()) && s.index() == segment.index())
                    .map(DeviceSegment::path)
                    .findFirst()
                    .orElseThrow(() -> new NoSuchFileException(segment.path().toString()));
        }
    }

    private void appendLocked(DeviceSlot slot, List<Reading> readings) throws IOException {
        ensureInitialized(slot);
        int i = 0;
        while (i < readings.size()) {
            if (slot.activeCount >= maxReadingsPerFile) {
                slot.activeIndex++;
                slot.activeCount = 0;
            }
            int n = Math.min(maxReadingsPerFile - slot.activeCount, readings.size() - i);
            Path file = slot.directory.resolve(DeviceSegment.fileName(slot.fileId, slot.activeIndex));
            if (Files.notExists(file)) {
                // a new plain segment makes the partition a compaction candidate again
                Files.deleteIfExists(slot.directory.resolve(COMPRESSED_MARKER));
            }
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                for (int k = i; k < i + n; k++) {
                    writer.write(ReadingCodec.encode(readings.get(k)));
                    writer.write('\n');
                }
            }
            slot.activeCount += n;
            i += n;
        }
    }

    /**
     * Locates the active segment of a slot from the files on disk: the highest index, or the
     * next one if the highest is already compressed.
     */
    private void ensureInitialized(DeviceSlot slot) throws IOException {
        if (slot.initialized) {
            return;
        }
        Files.createDirectories(slot.directory);
        int highest = -1;
        boolean highestCompressed = false;
        try (Stream<Path> entries = Files.list(slot.directory)) {
            for (Path file : (Iterable<Path>) entries::iterator) {
                Optional<DeviceSegment> parsed = DeviceSegment.parse(slot.partition, file);
                if (parsed.isEmpty() || !parsed.get().deviceId().equals(slot.fileId)) {
                    continue;
                }
                DeviceSegment segment = parsed.get();
                if (segment.index() > highest) {
                    highest = segment.index();
                    highestCompressed = segment.compressed();
                } else if (segment.index() == highest) {
                    highestCompressed |= segment.compressed();
                }
            }
        }
        if (highest < 0) {
            slot.activeIndex = 0;
            slot.activeCount = 0;
        } else if (highestCompressed) {
            slot.activeIndex = highest + 1;
            slot.activeCount = 0;
        } else {
            slot.activeIndex = highest;
            slot.activeCount = countLines(slot.directory.resolve(DeviceSegment.fileName(slot.fileId, highest)));
        }
        slot.initialized = true;
    }

    private void compressSegment(Path source) throws IOException {
        Path target = source.resolveSibling(source.getFileName() + codec.getFileExtension());
        Path temp = source.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        try (InputStream in = Files.newInputStream(source);
             OutputStream out = codec.wrapOutputStream(Files.newOutputStream(temp))) {
            in.transferTo(out);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        Files.delete(source);
    }

    private static List<Reading> decode(Path file) throws IOException {
        ICompressionCodec fileCodec = CompressionCodecFactory.detectFromExtension(file.getFileName().toString());
        List<Reading> raw;
        try (InputStream in = fileCodec.wrapInputStream(new BufferedInputStream(Files.newInputStream(file)))) {
            raw = ReadingCodec.readAll(in);
        }
        List<Reading> readings = new ArrayList<>(raw.size());
        for (Reading reading : raw) {
            try {
                readings.add(DeviceAddresses.canonical(reading));
            } catch (IllegalArgumentException e) {
                throw new IOException("Invalid device address in " + file.getFileName() + ": " + reading.deviceAddr(), e);
            }
        }
        return readings;
    }

    private static int countLines(Path file) throws IOException {
        try (Stream<String> lines = Files.lines(file, StandardCharsets.UTF_8)) {
            return (int) lines.filter(line -> !line.isBlank()).count();
        }
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return 0L;
        }
    }

    private static Reading requireReading(Reading reading) {
        if (reading == null) {
            throw new IllegalArgumentException("Reading must not be null");
        }
        return reading;
    }

    private Path partitionDirectory(PartitionId partition) {
        return rootDirectory.resolve(partition.name());
    }

    private DeviceSlot slot(PartitionId partition, String fileId) {
        return slots.computeIfAbsent(slotKey(partition, fileId),
                k -> new DeviceSlot(partition, fileId, partitionDirectory(partition)));
    }

    /**
     * Locks the live slot of a (partition, device) pair. A slot retired by
     * {@link #deletePartition} while this thread waited is skipped in favour of a fresh one.
     */
    private DeviceSlot acquire(PartitionId partition, String fileId, boolean exclusive) {
        while (true) {
            DeviceSlot slot = slot(partition, fileId);
            Lock lock = slot.lock(exclusive);
            lock.lock();
            if (!slot.retired) {
                return slot;
            }
            lock.unlock();
        }
    }

    private static void release(DeviceSlot slot, boolean exclusive) {
        slot.lock(exclusive).unlock();
    }

    private static String slotKey(PartitionId partition, String fileId) {
        return partition.name() + "/" + fileId;
    }

    private static String fileIdOf(String slotKey) {
        return slotKey.substring(slotKey.indexOf('/') + 1);
    }

    /**
     * Lock and active-segment bookkeeping of one device within one partition. Mutable fields
     * are guarded by the write lock.
     */
    private static final class DeviceSlot {
        final PartitionId partition;
        final String fileId;
        final Path directory;
        final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        volatile boolean retired;
        boolean initialized;
        int activeIndex;
        int activeCount;

        DeviceSlot(PartitionId partition, String fileId, Path directory) {
            this.partition = partition;
            this.fileId = fileId;
            this.directory = directory;
        }

        Lock lock(boolean exclusive) {
            return exclusive ? lock.writeLock() : lock.readLock();
        }
    }
}
