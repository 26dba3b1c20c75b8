package de.mirkosertic.archivesync.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;

import java.io.Closeable;
import java.util.Set;

/**
 * Anything capable of producing records for a key, eagerly or lazily.
 * <p>
 * Implementations declare which tags their records carry and whether meta and data should be
 * fetched eagerly by {@link #fetch(long)}. Lazy fetching keeps bulk iteration cheap.
 */
public interface RecordSource extends Closeable {

    /**
     * Tags added to every record produced by this source.
     */
    Set<RecordTag> getTags();

    /**
     * True if {@link #fetch(long)} should populate meta eagerly.
     */
    default boolean isPrefetchMeta() {
        return false;
    }

    /**
     * True if {@link #fetch(long)} should populate data eagerly.
     */
    default boolean isPrefetchData() {
        return false;
    }

    /**
     * Fetches a record using the declared prefetch defaults.
     *
     * @throws RecordNotFoundException if a valid record is not found
     * @throws SourceException         if the source does not return any data
     */
    default ArchiveRecord fetch(final long key) {
        return fetch(key, null, null);
    }

    /**
     * Fetches a record, optionally overriding the declared prefetch defaults.
     *
     * @param key           primary key of the record
     * @param prefetchMeta  force or suppress meta prefetching, null for the default
     * @param prefetchData  force or suppress data prefetching, null for the default
     * @throws RecordNotFoundException if a valid record is not found
     * @throws SourceException         if the source does not return any data
     */
    default ArchiveRecord fetch(final long key,
                                final @Nullable Boolean prefetchMeta,
                                final @Nullable Boolean prefetchData) {
        final boolean loadMeta = prefetchMeta != null ? prefetchMeta : isPrefetchMeta();
        final boolean loadData = prefetchData != null ? prefetchData : isPrefetchData();

        final ObjectNode meta = loadMeta ? fetchMeta(key) : null;
        final byte[] data = loadData ? fetchData(key) : null;

        return new ArchiveRecord(key, this, meta, data, getTags());
    }

    /**
     * Fetches record meta information.
     *
     * @throws RecordNotFoundException if a valid record is not found
     * @throws SourceException         if the source does not return any data
     */
    ObjectNode fetchMeta(long key);

    /**
     * Fetches record content data.
     *
     * @throws RecordNotFoundException if a valid record is not found
     * @throws SourceException         if the source does not return any data
     */
    byte[] fetchData(long key);

    /**
     * Closes file descriptors and frees memory. The default does nothing.
     */
    @Override
    default void close() {
    }
}
