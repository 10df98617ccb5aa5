package org.sensorvault.storage.migration;

import java.time.Duration;
import java.util.List;

/**
 * Summary of a migration run.
 *
 * @param state            final state
 * @param segmentsScanned  segments decoded successfully
 * @param segmentsSkipped  unreadable segments that were skipped
 * @param readingsScanned  readings decoded from the source
 * @param readingsCopied   readings written to the destination
 * @param chunksCommitted  chunks written to the destination
 * @param mismatches       per-device verification differences
 * @param failure          cause of a {@link MigrationState#FAILED} run, otherwise {@code null}
 * @param elapsed          wall time
 */
public record MigrationReport(
        MigrationState state,
        long segmentsScanned,
        long segmentsSkipped,
        long readingsScanned,
        long readingsCopied,
        long chunksCommitted,
        List<DeviceMismatch> mismatches,
        MigrationException failure,
        Duration elapsed) {

    public MigrationReport {
        mismatches = List.copyOf(mismatches);
    }

    public boolean isSucceeded() {
        return state == MigrationState.SUCCEEDED;
    }

    public boolean hasMismatches() {
        return !mismatches.isEmpty();
    }
}
