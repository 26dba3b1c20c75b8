package de.mirkosertic.archivesync.index;

import java.util.Locale;

/**
 * Storage strategies for a loaded archive index.
 */
public enum IndexBackendType {
    /** Encoded entries held in a hash map. */
    MEMORY,
    /** Encoded entries stored in an on-disk Lucene index. */
    LUCENE,
    /** Encoded entries stored in a single-file embedded H2 database. */
    H2,
    /** {@link #MEMORY} for small indexes, {@link #H2} for large ones. */
    AUTO;

    /**
     * Resolves {@link #AUTO} against the uncompressed size of the index.
     *
     * @param indexBytes       uncompressed size of {@code index.json}, negative if unknown
     * @param memoryLimitBytes largest index that is still held in memory
     * @return a concrete backend type, never {@link #AUTO}
     */
    public IndexBackendType resolve(final long indexBytes, final long memoryLimitBytes) {
        if (this != AUTO) {
            return this;
        }
        if (indexBytes >= 0 && indexBytes <= memoryLimitBytes) {
            return MEMORY;
        }
        return H2;
    }

    public static IndexBackendType fromName(final String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
