package de.mirkosertic.archivesync.sync;

import de.mirkosertic.archivesync.model.ArchiveRecord;

import java.io.IOException;

/**
 * Destination for processed records.
 */
@FunctionalInterface
public interface RecordSink {

    void write(ArchiveRecord record) throws IOException;

    /**
     * Writes the record, replacing whatever an unfinished earlier attempt left behind for its key.
     */
    default void rewrite(final ArchiveRecord record) throws IOException {
        write(record);
    }
}
