package org.sensorvault.storage;

import java.time.Instant;

import org.sensorvault.storage.api.Reading;

/**
 * Reading factory shared by storage tests.
 */
public final class TestReadings {

    public static final String DEVICE_A = "A4:C1:38:00:00:0A";
    public static final String DEVICE_B = "A4:C1:38:00:00:0B";
    public static final String DEVICE_C = "A4:C1:38:00:00:0C";

    private TestReadings() {
    }

    public static Reading reading(String device, Instant timestamp) {
        return reading(device, timestamp, 21.5);
    }

    public static Reading reading(String device, Instant timestamp, double tempC) {
        return Reading.measured(device, "LYWSD03MMC", timestamp, tempC, 45.0, 87, -70, "client-1");
    }

    public static Reading reading(String device, String timestamp) {
        return reading(device, Instant.parse(timestamp));
    }
}
