package org.sensorvault.storage.migration;

import java.util.List;

import org.sensorvault.storage.api.Reading;
import org.sensorvault.storage.file.DeviceSegment;

/**
 * Readings decoded from one source segment, in file order.
 *
 * @param segment  the segment they came from
 * @param readings decoded readings
 */
public record SourceBatch(DeviceSegment segment, List<Reading> readings) {

    public SourceBatch {
        readings = List.copyOf(readings);
    }

    public String partitionName() {
        return segment.partition().name();
    }
}
