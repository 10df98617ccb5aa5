package org.sensorvault.storage.api;

/**
 * Minimum, maximum and mean of one numeric reading field.
 *
 * @param min smallest observed value
 * @param max largest observed value
 * @param avg arithmetic mean
 */
public record FieldStats(double min, double max, double avg) {

    /** Value reported for devices without any readings. */
    public static final FieldStats EMPTY = new FieldStats(0.0, 0.0, 0.0);
}
