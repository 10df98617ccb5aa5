package org.sensorvault.storage.api;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Temperature and humidity aggregated over one clock hour of one device.
 *
 * @param deviceAddr the device
 * @param hour       start of the hour (UTC, truncated)
 * @param count      number of readings in the hour
 * @param tempC      temperature statistics
 * @param humidity   humidity statistics
 */
public record HourlyAggregate(String deviceAddr, Instant hour, long count, FieldStats tempC, FieldStats humidity) {

    /**
     * Groups readings by UTC clock hour and aggregates each group.
     *
     * @param deviceAddr the device
     * @param readings   readings of the device, in any order
     * @return aggregates ascending by hour
     */
    public static List<HourlyAggregate> of(String deviceAddr, List<Reading> readings) {
        Map<Instant, List<Reading>> byHour = new TreeMap<>();
        for (Reading r : readings) {
            byHour.computeIfAbsent(r.timestamp().truncatedTo(ChronoUnit.HOURS), h -> new ArrayList<>()).add(r);
        }
        List<HourlyAggregate> result = new ArrayList<>(byHour.size());
        for (Map.Entry<Instant, List<Reading>> entry : byHour.entrySet()) {
            DeviceStats stats = DeviceStats.of(deviceAddr, entry.getValue());
            result.add(new HourlyAggregate(deviceAddr, entry.getKey(), stats.count(), stats.tempC(), stats.humidity()));
        }
        return result;
    }
}
