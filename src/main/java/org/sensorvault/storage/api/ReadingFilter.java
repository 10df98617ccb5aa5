package org.sensorvault.storage.api;

import java.time.Instant;

/**
 * Optional criteria of a paged reading listing. {@code null} components do not filter.
 *
 * @param deviceAddr only readings of this device
 * @param clientId   only readings reported by this client
 * @param from       lower timestamp bound, inclusive
 * @param to         upper timestamp bound, inclusive
 */
public record ReadingFilter(String deviceAddr, String clientId, Instant from, Instant to) {

    public static final ReadingFilter ALL = new ReadingFilter(null, null, null, null);

    public ReadingFilter {
        if (deviceAddr != null) {
            deviceAddr = DeviceAddresses.canonical(deviceAddr);
        }
        if (clientId != null && clientId.isEmpty()) {
            clientId = null;
        }
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("'from' (" + from + ") is after 'to' (" + to + ")");
        }
    }

    public static ReadingFilter device(String deviceAddr) {
        return new ReadingFilter(deviceAddr, null, null, null);
    }

    public boolean matches(Reading reading) {
        Instant t = reading.timestamp();
        return (deviceAddr == null || deviceAddr.equals(reading.deviceAddr()))
                && (clientId == null || clientId.equals(reading.clientId()))
                && (from == null || !t.isBefore(from))
                && (to == null || !t.isAfter(to));
    }
}
