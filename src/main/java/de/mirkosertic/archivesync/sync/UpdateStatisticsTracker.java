package de.mirkosertic.archivesync.sync;

import de.mirkosertic.archivesync.model.ArchiveRecord;
import de.mirkosertic.archivesync.model.UpdateStatus;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts update task events and logs progress.
 * Thread-safe, so statistics may be read while the task is running.
 */
public class UpdateStatisticsTracker implements UpdateObserver {

    private static final Logger logger = LoggerFactory.getLogger(UpdateStatisticsTracker.class);

    private final AtomicLong attempts = new AtomicLong(0);
    private final AtomicLong created = new AtomicLong(0);
    private final AtomicLong revived = new AtomicLong(0);
    private final AtomicLong updated = new AtomicLong(0);
    private final AtomicLong deleted = new AtomicLong(0);
    private final AtomicLong skipped = new AtomicLong(0);
    private final AtomicLong failures = new AtomicLong(0);
    private final AtomicLong lastKey = new AtomicLong(-1);

    private final ScheduledExecutorService progressTimerExecutor =
            Executors.newSingleThreadScheduledExecutor(r -> {
                final Thread t = new Thread(r, "update-progress-timer");
                t.setDaemon(true);
                return t;
            });
    private volatile @Nullable ScheduledFuture<?> progressTimerFuture;

    private volatile long startTime = System.currentTimeMillis();

    public void reset() {
        attempts.set(0);
        created.set(0);
        revived.set(0);
        updated.set(0);
        deleted.set(0);
        skipped.set(0);
        failures.set(0);
        lastKey.set(-1);
        startTime = System.currentTimeMillis();
    }

    @Override
    public void onAttempt(final long key, final int skippedInARow, final int retriedInARow) {
        attempts.incrementAndGet();
        lastKey.set(key);
        logger.debug("Attempting key {} (skips: {}, retries: {})", key, skippedInARow, retriedInARow);
    }

    @Override
    public void onSuccess(final long key, final ArchiveRecord record, final UpdateStatus status) {
        switch (status) {
            case CREATED:
                created.incrementAndGet();
                break;
            case REVIVED:
                revived.incrementAndGet();
                break;
            case UPDATED:
                updated.incrementAndGet();
                break;
            case DELETED:
                deleted.incrementAndGet();
                break;
            default:
                break;
        }
        logger.debug("Key {} {}", key, status);
    }

    @Override
    public void onSkipped(final long key, final @Nullable ArchiveRecord record) {
        skipped.incrementAndGet();
        if (record != null) {
            logger.warn("Skipped key {} with content", key);
        } else {
            logger.debug("Skipped key {}", key);
        }
    }

    @Override
    public void onFailure(final long key, final Exception error) {
        failures.incrementAndGet();
        logger.warn("Failed to update key {}: {}", key, error.getMessage());
    }

    /**
     * Start logging progress at a fixed interval.
     */
    public void startPeriodicLogging(final Duration interval) {
        final long intervalMs = interval.toMillis();
        progressTimerFuture = progressTimerExecutor.scheduleAtFixedRate(
                this::logProgress,
                intervalMs,
                intervalMs,
                TimeUnit.MILLISECONDS
        );
        logger.debug("Started periodic progress logging every {}ms", intervalMs);
    }

    /**
     * Stop periodic logging and shut down the timer.
     */
    public void shutdown() {
        final ScheduledFuture<?> future = progressTimerFuture;
        if (future != null) {
            future.cancel(false);
            progressTimerFuture = null;
        }
        progressTimerExecutor.shutdown();
        try {
            if (!progressTimerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                progressTimerExecutor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            progressTimerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    void logProgress() {
        try {
            logger.info("Update progress: {}", format(getStatistics()));
        } catch (final RuntimeException e) {
            // A throwing task would silently cancel the schedule
            logger.error("Failed to log update progress", e);
        }
    }

    public void logSummary() {
        final UpdateStatistics stats = getStatistics();
        logger.info("Update finished after {}s: {}", stats.elapsedTimeMs() / 1000, format(stats));
    }

    private static String format(final UpdateStatistics stats) {
        return String.format(
                "key %d, %d created, %d updated, %d revived, %d deleted, %d skipped, %d failures (%.1f keys/min)",
                stats.lastKey(),
                stats.created(),
                stats.updated(),
                stats.revived(),
                stats.deleted(),
                stats.skipped(),
                stats.failures(),
                stats.keysPerMinute()
        );
    }

    public UpdateStatistics getStatistics() {
        return new UpdateStatistics(
                attempts.get(),
                created.get(),
                revived.get(),
                updated.get(),
                deleted.get(),
                skipped.get(),
                failures.get(),
                lastKey.get(),
                startTime,
                System.currentTimeMillis()
        );
    }
}
