package io.scrapejobs.core;

/**
 * Result of a store corruption scan.
 *
 * scanned     : records looked at
 * valid       : records that parsed and passed validation
 * quarantined : records moved aside
 */
public record RepairReport(
        int scanned,
        int valid,
        int quarantined
) {
    public boolean clean() {
        return quarantined == 0;
    }
}
