package org.sensorvault.storage.partition;

import java.time.Duration;

/**
 * Calendar unit a partition spans.
 */
public enum PartitionGranularity {
    /** One calendar day, identifier {@code YYYY-MM-DD}. */
    DAILY,
    /** One ISO-8601 week (Monday to Sunday), identifier {@code YYYY-Www}. */
    WEEKLY,
    /** One calendar month, identifier {@code YYYY-MM}. */
    MONTHLY;

    private static final Duration ONE_DAY = Duration.ofDays(1);
    private static final Duration ONE_WEEK = Duration.ofDays(7);

    /**
     * Maps a configured partition interval to a granularity: up to 24h is daily, up to 7 days
     * is weekly, anything longer is monthly.
     *
     * @param interval configured interval, must be positive
     * @return the granularity
     */
    public static PartitionGranularity fromInterval(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Partition interval must be positive: " + interval);
        }
        if (interval.compareTo(ONE_DAY) <= 0) {
            return DAILY;
        }
        if (interval.compareTo(ONE_WEEK) <= 0) {
            return WEEKLY;
        }
        return MONTHLY;
    }
}
