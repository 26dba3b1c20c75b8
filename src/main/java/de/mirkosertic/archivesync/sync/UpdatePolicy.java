package de.mirkosertic.archivesync.sync;

import java.time.Duration;

/**
 * Rate-limit and termination settings of an {@link UpdateTask}.
 *
 * @param successDelay pause after a record was selected and written
 * @param skippedDelay pause after a key yielded nothing to write
 * @param failureDelay pause before retrying a key that failed
 * @param maxRetries   consecutive failures after which the task stops
 * @param maxSkips     consecutive skipped keys after which the task stops
 */
public record UpdatePolicy(Duration successDelay,
                           Duration skippedDelay,
                           Duration failureDelay,
                           int maxRetries,
                           int maxSkips) {

    public static final Duration DEFAULT_SUCCESS_DELAY = Duration.ofSeconds(5);
    public static final Duration DEFAULT_SKIPPED_DELAY = Duration.ofSeconds(2);
    public static final Duration DEFAULT_FAILURE_DELAY = Duration.ofSeconds(300);
    public static final int DEFAULT_MAX_RETRIES = 10;
    public static final int DEFAULT_MAX_SKIPS = 500;

    public UpdatePolicy {
        if (successDelay.isNegative() || skippedDelay.isNegative() || failureDelay.isNegative()) {
            throw new IllegalArgumentException("Delays must not be negative");
        }
        if (maxRetries < 1 || maxSkips < 1) {
            throw new IllegalArgumentException("maxRetries and maxSkips must be at least 1");
        }
    }

    public static UpdatePolicy defaults() {
        return new UpdatePolicy(DEFAULT_SUCCESS_DELAY, DEFAULT_SKIPPED_DELAY, DEFAULT_FAILURE_DELAY,
                DEFAULT_MAX_RETRIES, DEFAULT_MAX_SKIPS);
    }
}
