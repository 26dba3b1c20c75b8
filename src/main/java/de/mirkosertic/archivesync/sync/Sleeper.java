package de.mirkosertic.archivesync.sync;

import java.time.Duration;

/**
 * Pauses the calling thread. Injected so that delays can be observed in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
