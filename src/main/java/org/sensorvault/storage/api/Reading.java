package org.sensorvault.storage.api;

import java.time.Instant;
import java.util.Objects;

/**
 * One immutable sensor measurement.
 * <p>
 * Readings are write-once: no backend ever mutates a stored reading. The ordering key for
 * every query is {@code (deviceAddr, timestamp)}, where {@code timestamp} is the event time
 * reported by the sensor, not the time the reading reached the server.
 *
 * @param deviceAddr    stable device identity (MAC address, e.g. {@code A4:C1:38:12:34:56})
 * @param deviceName    advertised device name
 * @param timestamp     event time
 * @param tempC         temperature in degrees Celsius
 * @param tempF         temperature in degrees Fahrenheit
 * @param humidity      relative humidity in percent
 * @param battery       battery level in percent
 * @param rssi          received signal strength in dBm
 * @param clientId      identifier of the scanner client that reported the reading
 * @param dewPointC     derived dew point in degrees Celsius
 * @param absHumidity   derived absolute humidity in g/m³
 * @param steamPressure derived water vapour pressure in hPa
 */
public record Reading(
        String deviceAddr,
        String deviceName,
        Instant timestamp,
        double tempC,
        double tempF,
        double humidity,
        int battery,
        int rssi,
        String clientId,
        double dewPointC,
        double absHumidity,
        double steamPressure) {

    // Magnus formula coefficients (Sonntag 1990, over water)
    private static final double MAGNUS_A = 17.62;
    private static final double MAGNUS_B = 243.12;
    private static final double MAGNUS_E0 = 6.112;

    public Reading {
        Objects.requireNonNull(deviceAddr, "deviceAddr");
        Objects.requireNonNull(timestamp, "timestamp");
        if (deviceName == null) {
            deviceName = "";
        }
        if (clientId == null) {
            clientId = "";
        }
    }

    public Reading withDeviceAddr(String addr) {
        return new Reading(addr, deviceName, timestamp, tempC, tempF, humidity, battery, rssi, clientId,
                dewPointC, absHumidity, steamPressure);
    }

    /**
     * Creates a reading from raw sensor values and computes the derived fields.
     *
     * @param deviceAddr device MAC address
     * @param deviceName advertised device name
     * @param timestamp  event time
     * @param tempC      temperature in degrees Celsius
     * @param humidity   relative humidity in percent
     * @param battery    battery level in percent
     * @param rssi       signal strength in dBm
     * @param clientId   reporting client
     * @return a fully populated reading
     */
    public static Reading measured(String deviceAddr, String deviceName, Instant timestamp,
                                   double tempC, double humidity, int battery, int rssi, String clientId) {
        double saturation = MAGNUS_E0 * Math.exp(MAGNUS_A * tempC / (MAGNUS_B + tempC));
        double steamPressure = saturation * humidity / 100.0;
        double dewPoint = humidity > 0
                ? MAGNUS_B * Math.log(steamPressure / MAGNUS_E0) / (MAGNUS_A - Math.log(steamPressure / MAGNUS_E0))
                : Double.NaN;
        // 216.7 = 100 * M_water / R, converts hPa/K to g/m³
        double absHumidity = 216.7 * steamPressure / (273.15 + tempC);
        double tempF = tempC * 9.0 / 5.0 + 32.0;
        return new Reading(deviceAddr, deviceName, timestamp, tempC, tempF, humidity, battery, rssi, clientId,
                dewPoint, absHumidity, steamPressure);
    }
}
