package de.mirkosertic.archivesync.index;

import org.jspecify.annotations.Nullable;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Storage for encoded index entries.
 * <p>
 * Entries are stored by the single thread that owns the index while it is loading, and only
 * read after loading finished. Closing a backend drops everything it stored, including any
 * files it created.
 */
public interface IndexBackend extends Closeable {

    /**
     * Stores a batch of entries. Keys are unique across all batches.
     */
    void store(List<IndexEntry> entries) throws IOException;

    /**
     * Marks the end of loading. Called once, after the last {@link #store(List)}.
     */
    default void finishLoading() throws IOException {
    }

    /**
     * Returns the encoded meta stored for the key, or null if there is none.
     */
    byte @Nullable [] load(long key) throws IOException;

    /**
     * Number of stored entries.
     */
    long size();
}
