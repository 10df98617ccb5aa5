package org.sensorvault.storage.file;

import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.sensorvault.storage.partition.PartitionId;

/**
 * One file segment of a device within a partition.
 * <p>
 * File names: {@code readings_<device-id>.json} for the first segment,
 * {@code readings_<device-id>.<n>.json} for later ones, each optionally suffixed with the
 * compression extension ({@code .gz}).
 *
 * @param partition  owning partition
 * @param deviceId   device address without separators, lower case
 * @param index      segment number within the partition, starting at 0
 * @param path       absolute file path
 * @param compressed whether the segment is gzip-compressed (sealed)
 */
public record DeviceSegment(PartitionId partition, String deviceId, int index, Path path, boolean compressed) {

    static final String PREFIX = "readings_";
    static final String EXTENSION = ".json";

    private static final Pattern FILE_NAME =
            Pattern.compile("^readings_([0-9a-f]{12})(?:\\.(\\d+))?\\.json(\\.gz)?$");

    /**
     * Returns the uncompressed file name of a segment.
     */
    public static String fileName(String deviceId, int index) {
        return index == 0
                ? PREFIX + deviceId + EXTENSION
                : PREFIX + deviceId + "." + index + EXTENSION;
    }

    /**
     * Parses a file inside a partition directory.
     *
     * @param partition the partition the file lives in
     * @param file      the file
     * @return the segment, or empty for files that are not segments (temp files, markers)
     */
    public static Optional<DeviceSegment> parse(PartitionId partition, Path file) {
        Matcher m = FILE_NAME.matcher(file.getFileName().toString());
        if (!m.matches()) {
            return Optional.empty();
        }
        int index = m.group(2) == null ? 0 : Integer.parseInt(m.group(2));
        return Optional.of(new DeviceSegment(partition, m.group(1), index, file, m.group(3) != null));
    }

    @Override
    public String toString() {
        return partition.name() + "/" + path.getFileName();
    }
}
