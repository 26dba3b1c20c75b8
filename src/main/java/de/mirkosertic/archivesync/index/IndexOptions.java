package de.mirkosertic.archivesync.index;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Settings for loading an {@link ArchiveIndex}.
 *
 * @param backend          storage strategy for parsed entries
 * @param workers          number of parser threads
 * @param chunkLines       number of index lines handed to a parser thread at once
 * @param compress         whether encoded entries are deflated
 * @param memoryLimitBytes largest uncompressed index that {@link IndexBackendType#AUTO} keeps in memory
 * @param pathCacheSize    maximum number of cached payload paths
 * @param cacheDirectory   parent directory for on-disk backends, or null for the system temp directory
 */
public record IndexOptions(IndexBackendType backend,
                           int workers,
                           int chunkLines,
                           boolean compress,
                           long memoryLimitBytes,
                           long pathCacheSize,
                           @Nullable Path cacheDirectory) {

    public static final long DEFAULT_MEMORY_LIMIT = 256L * 1024 * 1024;

    public IndexOptions {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1");
        }
        if (chunkLines < 1) {
            throw new IllegalArgumentException("chunkLines must be at least 1");
        }
        if (pathCacheSize < 0) {
            throw new IllegalArgumentException("pathCacheSize must not be negative");
        }
    }

    public static IndexOptions defaults() {
        return new IndexOptions(IndexBackendType.AUTO,
                Math.max(1, Runtime.getRuntime().availableProcessors() - 1),
                1000, true, DEFAULT_MEMORY_LIMIT, 10_000, null);
    }

    public IndexOptions withBackend(final IndexBackendType type) {
        return new IndexOptions(type, workers, chunkLines, compress, memoryLimitBytes, pathCacheSize, cacheDirectory);
    }
}
