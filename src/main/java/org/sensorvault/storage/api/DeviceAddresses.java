package org.sensorvault.storage.api;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validation and normalisation of device MAC addresses.
 * <p>
 * Both backends key readings by the canonical form ({@code A4:C1:38:12:34:56}), so an address
 * written or queried as {@code a4c138123456} or {@code a4:c1:38:12:34:56} reaches the same
 * readings everywhere.
 */
public final class DeviceAddresses {

    // six octets, each pair optionally preceded by a colon
    private static final Pattern MAC_PATTERN = Pattern.compile("^[0-9A-Fa-f]{2}(:?[0-9A-Fa-f]{2}){5}$");

    private DeviceAddresses() {
    }

    public static boolean isValid(String deviceAddr) {
        return deviceAddr != null && MAC_PATTERN.matcher(deviceAddr).matches();
    }

    /**
     * Returns the canonical spelling of a MAC address: upper case, octets separated by colons.
     *
     * @param deviceAddr the device address in any accepted spelling
     * @return the canonical address
     * @throws IllegalArgumentException if the address is not a MAC address
     */
    public static String canonical(String deviceAddr) {
        String hex = toFileId(deviceAddr).toUpperCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(17);
        for (int i = 0; i < hex.length(); i += 2) {
            if (i > 0) {
                sb.append(':');
            }
            sb.append(hex, i, i + 2);
        }
        return sb.toString();
    }

    /**
     * Returns the reading itself if its address is already canonical, otherwise a copy carrying
     * the canonical address.
     *
     * @throws IllegalArgumentException if the reading is null or its address is not a MAC address
     */
    public static Reading canonical(Reading reading) {
        if (reading == null) {
            throw new IllegalArgumentException("Reading must not be null");
        }
        String addr = canonical(reading.deviceAddr());
        return addr.equals(reading.deviceAddr()) ? reading : reading.withDeviceAddr(addr);
    }

    /**
     * Converts a MAC address into the identifier used in file names: separators removed,
     * lower case. {@code A4:C1:38:12:34:56} becomes {@code a4c138123456}.
     *
     * @param deviceAddr the device address
     * @return the 12-character file-name identifier
     * @throws IllegalArgumentException if the address is not a MAC address (prevents path traversal)
     */
    public static String toFileId(String deviceAddr) {
        if (!isValid(deviceAddr)) {
            throw new IllegalArgumentException("Invalid device address format: " + deviceAddr);
        }
        return deviceAddr.replace(":", "").toLowerCase(Locale.ROOT);
    }
}
