package org.sensorvault.storage.migration;

/**
 * Phases of a migration run. {@link #SUCCEEDED} and {@link #FAILED} are terminal.
 */
public enum MigrationState {
    PENDING,
    SCANNING,
    COPYING,
    VERIFYING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
