package io.scrapejobs.core;

/**
 * Summary of the startup reconciliation pass.
 */
public record RecoveryReport(
        int scanned,
        int orphansReset,
        int overdue,
        int failed
) {
    public static RecoveryReport empty() {
        return new RecoveryReport(0, 0, 0, 0);
    }
}
