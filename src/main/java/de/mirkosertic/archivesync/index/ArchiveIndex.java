package de.mirkosertic.archivesync.index;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import de.mirkosertic.archivesync.model.ArchiveRecord;
import de.mirkosertic.archivesync.model.DataFormat;
import de.mirkosertic.archivesync.model.MetaPurity;
import de.mirkosertic.archivesync.model.Origin;
import de.mirkosertic.archivesync.model.RecordNotFoundException;
import de.mirkosertic.archivesync.model.RecordSource;
import de.mirkosertic.archivesync.model.RecordTag;
import de.mirkosertic.archivesync.model.SourceException;
import de.mirkosertic.archivesync.util.JsonSupport;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.AbstractMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;
import java.util.zip.ZipInputStream;

/**
 * Record source backed by an existing archive snapshot.
 * <p>
 * The archive is a zip container with an {@code index.json} entry mapping keys to meta. Each
 * meta names the container entry holding the record payload, either in {@code archive.path} or
 * in the legacy top-level {@code path} field.
 * <p>
 * Loading streams the index in chunks of lines that are parsed and re-encoded by a bounded pool
 * of worker threads. An index not written one entry per line is tokenized on the loading thread
 * instead, and only the re-encoding runs on the pool. The owning thread merges the results in order into the configured
 * {@link IndexBackend}, so the mapping is never mutated after construction.
 * <p>
 * Instances are meant to be used by a single orchestrator. Once closed, every lookup fails
 * with a {@link SourceException}.
 */
public class ArchiveIndex implements RecordSource, Iterable<ArchiveRecord> {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveIndex.class);

    public static final String INDEX_ENTRY = "index.json";

    private static final int LAYOUT_HEAD_BYTES = 64 * 1024;

    private static final Set<RecordTag> TAGS = Set.of(Origin.ARCHIVE, DataFormat.EPUB, MetaPurity.CLEAN);

    private final Path archivePath;
    private final MetaCodec codec;
    private final Cache<Long, String> pathCache;
    private final IndexBackendType backendType;

    private @Nullable ZipFile zipFile;
    private @Nullable IndexBackend backend;
    private long[] keys;
    private volatile boolean open;

    /**
     * Opens an archive with default options.
     *
     * @throws SourceException if no valid archive can be loaded
     */
    public static ArchiveIndex open(final Path archive) {
        return new ArchiveIndex(archive, IndexOptions.defaults());
    }

    /**
     * Opens an archive and loads its index.
     *
     * @throws SourceException if no valid archive can be loaded
     */
    public ArchiveIndex(final Path archive, final IndexOptions options) {
        this.archivePath = archive;
        this.codec = new MetaCodec(options.compress());
        this.pathCache = Caffeine.newBuilder()
                .maximumSize(options.pathCacheSize())
                .build();

        final long startTime = System.currentTimeMillis();
        final ZipFile zip = openContainer(archive);
        this.zipFile = zip;

        try {
            final ZipEntry indexEntry = zip.getEntry(INDEX_ENTRY);
            if (indexEntry == null) {
                throw new SourceException("Archive " + archive + " is missing the index.");
            }

            this.backendType = options.backend().resolve(indexEntry.getSize(), options.memoryLimitBytes());
            final IndexBackend created = createBackend(backendType, options);
            this.backend = created;
            this.keys = load(zip, indexEntry, created, options);
        } catch (final RuntimeException e) {
            releaseQuietly();
            throw e;
        }

        this.open = true;
        logger.info("Loaded archive index {} with {} entries using {} backend in {}ms",
                archive, keys.length, backendType, System.currentTimeMillis() - startTime);
    }

    private static ZipFile openContainer(final Path archive) {
        try {
            return new ZipFile(archive.toFile());
        } catch (final ZipException e) {
            throw new SourceException("Archive " + archive + " is not a valid zip file.", e);
        } catch (final IOException e) {
            throw new SourceException("Could not read from archive " + archive + ".", e);
        }
    }

    private static IndexBackend createBackend(final IndexBackendType type, final IndexOptions options) {
        final Path parent = options.cacheDirectory() != null
                ? options.cacheDirectory()
                : Path.of(System.getProperty("java.io.tmpdir"));
        try {
            switch (type) {
                case MEMORY:
                    return new MemoryIndexBackend();
                case LUCENE:
                    return new LuceneIndexBackend(parent);
                case H2:
                    return new H2IndexBackend(parent);
                default:
                    throw new IllegalArgumentException("Unresolved index backend type: " + type);
            }
        } catch (final IOException e) {
            throw new SourceException("Could not create " + type + " index backend in " + parent, e);
        }
    }

    private static long[] load(final ZipFile zip,
                               final ZipEntry indexEntry,
                               final IndexBackend backend,
                               final IndexOptions options) {
        final IndexEntryParser parser = new IndexEntryParser(new MetaCodec(options.compress()));
        final KeyCollector collector = new KeyCollector();

        final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);

        try (final IndexLoadExecutor executor = new IndexLoadExecutor(options.workers())) {
            final boolean lineLayout = isLineLayout(zip, indexEntry);
            final ChunkMerger merger = new ChunkMerger(executor, backend, collector, options.workers() * 2);
            try (final InputStream in = zip.getInputStream(indexEntry);
                 final BufferedReader reader = new BufferedReader(new InputStreamReader(in, decoder), 1 << 16)) {
                if (lineLayout) {
                    loadLines(reader, parser, merger, options.chunkLines());
                } else {
                    logger.info("Index of {} is not written one entry per line, reading it as a stream", zip.getName());
                    loadFields(reader, parser, merger, options.chunkLines());
                }
                merger.drain();
            } finally {
                merger.cancel();
            }

            backend.finishLoading();
        } catch (final CharacterCodingException e) {
            throw new SourceException("Index is incorrectly encoded.", e);
        } catch (final ZipException e) {
            throw new SourceException("Archive is corrupt.", e);
        } catch (final IOException e) {
            throw new SourceException("Could not read the archive index.", e);
        }

        return collector.sortedUniqueKeys();
    }

    private static boolean isLineLayout(final ZipFile zip, final ZipEntry indexEntry) throws IOException {
        try (final InputStream in = zip.getInputStream(indexEntry)) {
            return IndexEntryParser.isLineLayout(new String(in.readNBytes(LAYOUT_HEAD_BYTES), StandardCharsets.UTF_8));
        }
    }

    private static void loadLines(final BufferedReader reader,
                                  final IndexEntryParser parser,
                                  final ChunkMerger merger,
                                  final int chunkSize) throws IOException {
        List<String> chunk = new ArrayList<>(chunkSize);
        String line;
        while ((line = reader.readLine()) != null) {
            chunk.add(line);
            if (chunk.size() >= chunkSize) {
                final List<String> lines = chunk;
                merger.submit(() -> parser.parseAll(lines));
                chunk = new ArrayList<>(chunkSize);
            }
        }
        if (!chunk.isEmpty()) {
            final List<String> lines = chunk;
            merger.submit(() -> parser.parseAll(lines));
        }
    }

    private static void loadFields(final BufferedReader reader,
                                   final IndexEntryParser parser,
                                   final ChunkMerger merger,
                                   final int chunkSize) throws IOException {
        final ObjectMapper mapper = JsonSupport.mapper();
        @Nullable String rawKey = null;
        try (final JsonParser json = mapper.createParser(reader)) {
            if (json.nextToken() != JsonToken.START_OBJECT) {
                throw new SourceException("Index is not a JSON object.");
            }

            List<Map.Entry<String, JsonNode>> chunk = new ArrayList<>(chunkSize);
            JsonToken token;
            while ((token = json.nextToken()) == JsonToken.FIELD_NAME) {
                rawKey = json.currentName();
                json.nextToken();
                final JsonNode value = mapper.readTree(json);
                chunk.add(new AbstractMap.SimpleImmutableEntry<>(rawKey, value != null ? value : NullNode.getInstance()));
                if (chunk.size() >= chunkSize) {
                    final List<Map.Entry<String, JsonNode>> fields = chunk;
                    merger.submit(() -> parser.parseTrees(fields));
                    chunk = new ArrayList<>(chunkSize);
                }
            }
            if (token != JsonToken.END_OBJECT) {
                throw new SourceException("Index is not a complete JSON object.");
            }
            if (!chunk.isEmpty()) {
                final List<Map.Entry<String, JsonNode>> fields = chunk;
                merger.submit(() -> parser.parseTrees(fields));
            }
        } catch (final JsonProcessingException e) {
            final String position = rawKey != null ? " after key " + rawKey : "";
            throw new SourceException("Malformed index" + position + ": " + e.getOriginalMessage(), e);
        }
    }

    public Path getArchivePath() {
        return archivePath;
    }

    public IndexBackendType getBackendType() {
        return backendType;
    }

    public boolean isOpen() {
        return open;
    }

    @Override
    public Set<RecordTag> getTags() {
        return TAGS;
    }

    @Override
    public boolean isPrefetchMeta() {
        return true;
    }

    @Override
    public boolean isPrefetchData() {
        return false;
    }

    /**
     * Number of records in the archive.
     */
    public int size() {
        requireOpen();
        return keys.length;
    }

    /**
     * All keys of the archive in ascending order.
     */
    public long[] keys() {
        requireOpen();
        return keys.clone();
    }

    /**
     * Checks that the key exists in this archive.
     *
     * @return the key
     * @throws RecordNotFoundException if the archive has no such record
     * @throws SourceException         if the index has been closed
     */
    public long validate(final long key) {
        requireOpen();
        if (Arrays.binarySearch(keys, key) < 0) {
            throw new RecordNotFoundException("No such record in archive: " + key);
        }
        return key;
    }

    @Override
    public ArchiveRecord fetch(final long key,
                               final @Nullable Boolean prefetchMeta,
                               final @Nullable Boolean prefetchData) {
        validate(key);
        return RecordSource.super.fetch(key, prefetchMeta, prefetchData);
    }

    /**
     * Returns a private copy of the stored meta and remembers its payload path.
     *
     * @throws SourceException if the stored meta does not declare the requested key as its id
     */
    @Override
    public ObjectNode fetchMeta(final long key) {
        validate(key);

        final byte[] encoded;
        try {
            encoded = requireBackend().load(key);
        } catch (final IOException e) {
            throw new SourceException("Could not read index entry for key " + key, e);
        }
        if (encoded == null) {
            throw new SourceException("Index backend lost the entry for key " + key);
        }

        final ObjectNode meta = codec.decode(key, encoded);
        final Long id = JsonSupport.idOf(meta);
        if (id == null || id != key) {
            throw new SourceException("Index entry for key " + key + " declares id " + id);
        }

        final String path = pathOf(meta);
        if (path != null) {
            pathCache.put(key, path);
        }
        return meta;
    }

    /**
     * Reads the record payload from the container and checks that it is an intact EPUB.
     *
     * @throws SourceException if the meta has no path, the container is corrupt or the payload
     *                         is corrupt
     */
    @Override
    public byte[] fetchData(final long key) {
        validate(key);

        String path = pathCache.getIfPresent(key);
        if (path == null) {
            path = pathOf(fetchMeta(key));
        }
        if (path == null) {
            throw new SourceException("Index is missing a path value for key " + key);
        }

        final ZipFile zip = requireContainer();
        final ZipEntry entry = zip.getEntry(path);
        if (entry == null) {
            throw new SourceException("Archive is missing file " + path + " for key " + key);
        }
        final byte[] data;
        try (final InputStream in = zip.getInputStream(entry)) {
            data = in.readAllBytes();
        } catch (final ZipException e) {
            throw new SourceException("Archive is corrupt at " + path, e);
        } catch (final IOException e) {
            throw new SourceException("Could not read " + path + " from archive", e);
        }

        verifyPayload(key, data);
        return data;
    }

    /**
     * Reads every entry of an EPUB payload to its end, which checks the entry checksums.
     *
     * @throws SourceException if the payload is not a readable zip container
     */
    static void verifyPayload(final long key, final byte[] data) {
        int entries = 0;
        try (final ZipInputStream story = new ZipInputStream(new ByteArrayInputStream(data))) {
            while (story.getNextEntry() != null) {
                story.transferTo(OutputStream.nullOutputStream());
                entries++;
            }
        } catch (final IOException e) {
            throw new SourceException("Story " + key + " is corrupt.", e);
        }
        if (entries == 0) {
            throw new SourceException("Story " + key + " is corrupt: no entries.");
        }
    }

    static @Nullable String pathOf(final JsonNode meta) {
        final JsonNode archive = meta.get("archive");
        if (archive != null && archive.isObject()) {
            final JsonNode path = archive.get("path");
            if (path != null && path.isTextual()) {
                return path.asText();
            }
        }
        final JsonNode legacy = meta.get("path");
        if (legacy != null && legacy.isTextual()) {
            return legacy.asText();
        }
        return null;
    }

    /**
     * Iterates all records in ascending key order. Records are created on demand.
     */
    @Override
    public Iterator<ArchiveRecord> iterator() {
        final long[] snapshot = keys();
        return new Iterator<>() {
            private int position;

            @Override
            public boolean hasNext() {
                return position < snapshot.length;
            }

            @Override
            public ArchiveRecord next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return fetch(snapshot[position++]);
            }
        };
    }

    private void requireOpen() {
        if (!open) {
            throw new SourceException("Archive index is closed.");
        }
    }

    private IndexBackend requireBackend() {
        final IndexBackend current = backend;
        if (current == null) {
            throw new SourceException("Archive index is closed.");
        }
        return current;
    }

    private ZipFile requireContainer() {
        final ZipFile current = zipFile;
        if (current == null) {
            throw new SourceException("Archive index is closed.");
        }
        return current;
    }

    /**
     * Releases the container and drops every cached entry. Closing twice is a no-op.
     *
     * @throws SourceException if a resource could not be released
     */
    @Override
    public void close() {
        if (!open && zipFile == null && backend == null) {
            return;
        }
        open = false;
        final IOException failure = release();
        logger.info("Closed archive index {}", archivePath);
        if (failure != null) {
            throw new SourceException("Failed to release archive index " + archivePath, failure);
        }
    }

    private void releaseQuietly() {
        final IOException failure = release();
        if (failure != null) {
            logger.warn("Failed to release archive index {} after load failure", archivePath, failure);
        }
    }

    private @Nullable IOException release() {
        IOException failure = null;
        pathCache.invalidateAll();
        keys = new long[0];

        if (backend != null) {
            try {
                backend.close();
            } catch (final IOException e) {
                failure = e;
            }
            backend = null;
        }
        if (zipFile != null) {
            try {
                zipFile.close();
            } catch (final IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
            zipFile = null;
        }
        return failure;
    }

    /**
     * Keeps a bounded number of parse chunks in flight and merges finished ones in submission order.
     */
    private static final class ChunkMerger {

        private final IndexLoadExecutor executor;
        private final IndexBackend backend;
        private final KeyCollector collector;
        private final int maxPending;
        private final Deque<Future<List<IndexEntry>>> pending = new ArrayDeque<>();

        ChunkMerger(final IndexLoadExecutor executor,
                    final IndexBackend backend,
                    final KeyCollector collector,
                    final int maxPending) {
            this.executor = executor;
            this.backend = backend;
            this.collector = collector;
            this.maxPending = maxPending;
        }

        void submit(final Callable<List<IndexEntry>> task) throws IOException {
            pending.addLast(executor.submit(task));
            while (pending.size() > maxPending) {
                merge(pending.removeFirst());
            }
        }

        void drain() throws IOException {
            while (!pending.isEmpty()) {
                merge(pending.removeFirst());
            }
        }

        void cancel() {
            pending.forEach(future -> future.cancel(true));
            pending.clear();
        }

        private void merge(final Future<List<IndexEntry>> future) throws IOException {
            final List<IndexEntry> entries;
            try {
                entries = future.get();
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SourceException("Interrupted while loading the archive index", e);
            } catch (final ExecutionException e) {
                final Throwable cause = e.getCause();
                if (cause instanceof SourceException) {
                    throw (SourceException) cause;
                }
                throw new SourceException("Failed to parse the archive index", cause);
            }

            for (final IndexEntry entry : entries) {
                collector.add(entry.key());
            }
            backend.store(entries);
        }
    }

    /**
     * Growable primitive key buffer.
     */
    private static final class KeyCollector {

        private long[] keys = new long[1024];
        private int size;

        void add(final long key) {
            if (size == keys.length) {
                keys = Arrays.copyOf(keys, size * 2);
            }
            keys[size++] = key;
        }

        long[] sortedUniqueKeys() {
            final long[] result = Arrays.copyOf(keys, size);
            Arrays.sort(result);
            for (int i = 1; i < result.length; i++) {
                if (result[i] == result[i - 1]) {
                    throw new SourceException("Index contains duplicate key " + result[i]);
                }
            }
            return result;
        }
    }
}
