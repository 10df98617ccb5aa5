package org.sensorvault.storage.migration;

/**
 * Verification difference for one device.
 *
 * @param deviceAddr          the device
 * @param sourceCount         distinct readings found in the file store
 * @param destinationCount    readings found in the destination
 * @param sourceChecksum      SHA-256 over the source readings, {@code null} if not computed
 * @param destinationChecksum SHA-256 over the destination readings, {@code null} if not computed
 */
public record DeviceMismatch(String deviceAddr, long sourceCount, long destinationCount,
                             String sourceChecksum, String destinationChecksum) {

    /**
     * Returns {@code sourceCount - destinationCount}; positive when readings are missing.
     */
    public long countDifference() {
        return sourceCount - destinationCount;
    }

    public boolean isChecksumMismatch() {
        return sourceCount == destinationCount;
    }

    @Override
    public String toString() {
        if (isChecksumMismatch()) {
            return String.format("%s: content differs (source %s, destination %s)",
                    deviceAddr, sourceChecksum, destinationChecksum);
        }
        return String.format("%s: source=%d destination=%d (missing %d)",
                deviceAddr, sourceCount, destinationCount, countDifference());
    }
}
