package de.mirkosertic.archivesync.sync;

/**
 * Snapshot of the counters of an {@link UpdateStatisticsTracker}.
 */
public record UpdateStatistics(
        long attempts,
        long created,
        long revived,
        long updated,
        long deleted,
        long skipped,
        long failures,
        /** Last key that was attempted, or -1 before the first attempt. */
        long lastKey,
        long startTimeMs,
        long endTimeMs
) {
    public long successes() {
        return created + revived + updated + deleted;
    }

    public double keysPerMinute() {
        final long elapsedMs = endTimeMs - startTimeMs;
        if (elapsedMs == 0) return 0;
        return (successes() + skipped) / (elapsedMs / 60000.0);
    }

    public long elapsedTimeMs() {
        return endTimeMs - startTimeMs;
    }
}
