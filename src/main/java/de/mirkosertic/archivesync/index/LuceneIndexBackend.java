package de.mirkosertic.archivesync.index;

import de.mirkosertic.archivesync.util.FileTrees;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.util.BytesRef;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Stores encoded entries in a private on-disk Lucene index.
 * <p>
 * Keys are indexed as {@link LongPoint} for exact lookups, the encoded meta is a stored binary
 * field. The index directory is deleted on {@link #close()}.
 */
public class LuceneIndexBackend implements IndexBackend {

    private static final Logger logger = LoggerFactory.getLogger(LuceneIndexBackend.class);

    static final String KEY_FIELD = "key";
    static final String META_FIELD = "meta";

    private final Path path;
    private final FSDirectory directory;
    private @Nullable IndexWriter indexWriter;
    private @Nullable DirectoryReader reader;
    private @Nullable IndexSearcher searcher;
    private long size;

    public LuceneIndexBackend(final Path parent) throws IOException {
        Files.createDirectories(parent);
        this.path = Files.createTempDirectory(parent, "archive-index-lucene-");
        this.directory = FSDirectory.open(path);

        final IndexWriterConfig config = new IndexWriterConfig();
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE);
        config.setRAMBufferSizeMB(64);
        this.indexWriter = new IndexWriter(directory, config);

        logger.debug("Lucene index backend created at {}", path);
    }

    Path getPath() {
        return path;
    }

    @Override
    public void store(final List<IndexEntry> entries) throws IOException {
        final IndexWriter writer = indexWriter;
        if (writer == null) {
            throw new IllegalStateException("Lucene backend is no longer accepting entries");
        }
        for (final IndexEntry entry : entries) {
            final Document doc = new Document();
            doc.add(new LongPoint(KEY_FIELD, entry.key()));
            doc.add(new StoredField(META_FIELD, entry.encodedMeta()));
            writer.addDocument(doc);
        }
        size += entries.size();
    }

    @Override
    public void finishLoading() throws IOException {
        final IndexWriter writer = indexWriter;
        if (writer == null) {
            return;
        }
        writer.forceMerge(1);
        writer.commit();
        writer.close();
        indexWriter = null;

        reader = DirectoryReader.open(directory);
        searcher = new IndexSearcher(reader);
        logger.debug("Lucene index backend committed {} entries", size);
    }

    @Override
    public byte @Nullable [] load(final long key) throws IOException {
        final IndexSearcher current = searcher;
        if (current == null) {
            throw new IllegalStateException("Lucene backend is not readable");
        }

        final TopDocs topDocs = current.search(LongPoint.newExactQuery(KEY_FIELD, key), 1);
        if (topDocs.scoreDocs.length == 0) {
            return null;
        }

        final Document doc = current.storedFields().document(topDocs.scoreDocs[0].doc);
        final BytesRef value = doc.getBinaryValue(META_FIELD);
        if (value == null) {
            return null;
        }
        return Arrays.copyOfRange(value.bytes, value.offset, value.offset + value.length);
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public void close() throws IOException {
        try {
            if (indexWriter != null) {
                indexWriter.rollback();
                indexWriter = null;
            }
            if (reader != null) {
                reader.close();
                reader = null;
            }
            searcher = null;
            directory.close();
        } finally {
            FileTrees.deleteRecursively(path);
            logger.debug("Lucene index backend at {} removed", path);
        }
    }
}
