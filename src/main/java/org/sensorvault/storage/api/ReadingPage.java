package org.sensorvault.storage.api;

import java.util.List;

/**
 * One page of a reading listing, newest first.
 *
 * @param readings the readings of this page
 * @param total    number of readings matching the filter across all pages
 * @param offset   index of the first reading of this page
 * @param limit    requested page size
 */
public record ReadingPage(List<Reading> readings, long total, int offset, int limit) {

    public ReadingPage {
        readings = List.copyOf(readings);
    }

    public boolean hasMore() {
        return offset + readings.size() < total;
    }
}
