package org.sensorvault.storage.api;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate statistics over every stored reading of one device.
 * <p>
 * A device without data yields {@link #empty(String)} (count zero, {@code null} timestamps),
 * never an error.
 *
 * @param deviceAddr     the device
 * @param count          number of stored readings
 * @param tempC          temperature statistics (Celsius)
 * @param tempF          temperature statistics (Fahrenheit)
 * @param humidity       relative humidity statistics
 * @param battery        battery level statistics
 * @param rssi           signal strength statistics
 * @param dewPointC      dew point statistics
 * @param absHumidity    absolute humidity statistics
 * @param steamPressure  vapour pressure statistics
 * @param firstReading   timestamp of the earliest reading, {@code null} if count is zero
 * @param lastReading    timestamp of the latest reading, {@code null} if count is zero
 */
public record DeviceStats(
        String deviceAddr,
        long count,
        FieldStats tempC,
        FieldStats tempF,
        FieldStats humidity,
        FieldStats battery,
        FieldStats rssi,
        FieldStats dewPointC,
        FieldStats absHumidity,
        FieldStats steamPressure,
        Instant firstReading,
        Instant lastReading) {

    public static DeviceStats empty(String deviceAddr) {
        return new DeviceStats(deviceAddr, 0,
                FieldStats.EMPTY, FieldStats.EMPTY, FieldStats.EMPTY, FieldStats.EMPTY, FieldStats.EMPTY,
                FieldStats.EMPTY, FieldStats.EMPTY, FieldStats.EMPTY, null, null);
    }

    public boolean isEmpty() {
        return count == 0;
    }

    /**
     * Computes statistics in memory from a list of readings.
     * <p>
     * Used by backends without an aggregating query engine.
     *
     * @param deviceAddr the device
     * @param readings   all readings of the device, in any order
     * @return the statistics, or {@link #empty(String)} for an empty list
     */
    public static DeviceStats of(String deviceAddr, List<Reading> readings) {
        if (readings.isEmpty()) {
            return empty(deviceAddr);
        }
        Accumulator tempC = new Accumulator();
        Accumulator tempF = new Accumulator();
        Accumulator humidity = new Accumulator();
        Accumulator battery = new Accumulator();
        Accumulator rssi = new Accumulator();
        Accumulator dewPoint = new Accumulator();
        Accumulator absHumidity = new Accumulator();
        Accumulator steamPressure = new Accumulator();
        Instant first = null;
        Instant last = null;

        for (Reading r : readings) {
            tempC.add(r.tempC());
            tempF.add(r.tempF());
            humidity.add(r.humidity());
            battery.add(r.battery());
            rssi.add(r.rssi());
            dewPoint.add(r.dewPointC());
            absHumidity.add(r.absHumidity());
            steamPressure.add(r.steamPressure());
            if (first == null || r.timestamp().isBefore(first)) {
                first = r.timestamp();
            }
            if (last == null || r.timestamp().isAfter(last)) {
                last = r.timestamp();
            }
        }

        return new DeviceStats(deviceAddr, readings.size(),
                tempC.toStats(), tempF.toStats(), humidity.toStats(), battery.toStats(), rssi.toStats(),
                dewPoint.toStats(), absHumidity.toStats(), steamPressure.toStats(), first, last);
    }

    private static final class Accumulator {
        private double min = Double.POSITIVE_INFINITY;
        private double max = Double.NEGATIVE_INFINITY;
        private double sum;
        private long count;

        // NaN marks an underivable value (dew point at 0 % humidity)
        void add(double value) {
            if (Double.isNaN(value)) {
                return;
            }
            min = Math.min(min, value);
            max = Math.max(max, value);
            sum += value;
            count++;
        }

        FieldStats toStats() {
            if (count == 0) {
                return FieldStats.EMPTY;
            }
            return new FieldStats(min, max, sum / count);
        }
    }
}
