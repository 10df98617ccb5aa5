package org.sensorvault.storage.partition;

import java.time.Instant;

/**
 * Canonical partition identifier together with the half-open time range {@code [start, end)}
 * it covers.
 * <p>
 * Identifiers of the same granularity sort lexically in the same order as their ranges.
 *
 * @param name        canonical name, also the directory name on disk
 * @param granularity calendar unit of the partition
 * @param start       inclusive start
 * @param end         exclusive end
 */
public record PartitionId(String name, PartitionGranularity granularity, Instant start, Instant end)
        implements Comparable<PartitionId> {

    public boolean contains(Instant t) {
        return !t.isBefore(start) && t.isBefore(end);
    }

    /**
     * Tests whether any instant of the inclusive range {@code [from, to]} falls into this partition.
     *
     * @param from lower bound, {@code null} for unbounded
     * @param to   upper bound, {@code null} for unbounded
     */
    public boolean overlaps(Instant from, Instant to) {
        boolean startsBeforeTo = to == null || !start.isAfter(to);
        boolean endsAfterFrom = from == null || end.isAfter(from);
        return startsBeforeTo && endsAfterFrom;
    }

    @Override
    public int compareTo(PartitionId other) {
        int byStart = start.compareTo(other.start);
        return byStart != 0 ? byStart : name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
