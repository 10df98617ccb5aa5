package org.sensorvault.storage.sweep;

import java.time.Duration;

/**
 * Outcome of one sweep pass.
 *
 * @param sweeper   name of the sweeper
 * @param examined  partitions (or other units) looked at
 * @param affected  units deleted or compressed
 * @param failed    units that failed and were skipped
 * @param cancelled whether the pass stopped early because of cancellation
 * @param elapsed   wall time of the pass
 */
public record SweepResult(String sweeper, long examined, long affected, long failed, boolean cancelled,
                          Duration elapsed) {

    @Override
    public String toString() {
        return String.format("%s: examined=%d affected=%d failed=%d%s (%d ms)",
                sweeper, examined, affected, failed, cancelled ? " cancelled" : "", elapsed.toMillis());
    }
}
