package de.mirkosertic.archivesync.sync;

import de.mirkosertic.archivesync.model.ArchiveRecord;
import de.mirkosertic.archivesync.model.UpdateStatus;
import org.jspecify.annotations.Nullable;

/**
 * Receives progress events from an {@link UpdateTask}. Called synchronously on the task thread.
 */
public interface UpdateObserver {

    UpdateObserver NONE = new UpdateObserver() {
    };

    static UpdateObserver none() {
        return NONE;
    }

    /**
     * A key is about to be processed.
     */
    default void onAttempt(final long key, final int skipped, final int retried) {
    }

    /**
     * A record was selected, stamped and written.
     */
    default void onSuccess(final long key, final ArchiveRecord record, final UpdateStatus status) {
    }

    /**
     * Nothing was selected for the key.
     *
     * @param record the record handed to the skip sink, or null if there was none
     */
    default void onSkipped(final long key, final @Nullable ArchiveRecord record) {
    }

    /**
     * Processing the key failed and will be retried.
     */
    default void onFailure(final long key, final Exception error) {
    }
}
