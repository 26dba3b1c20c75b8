package de.mirkosertic.archivesync.sync;

import de.mirkosertic.archivesync.model.ArchiveInvariantException;
import de.mirkosertic.archivesync.model.ArchiveRecord;
import de.mirkosertic.archivesync.model.DataFormat;
import de.mirkosertic.archivesync.model.Origin;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Routes records to the sink matching their tags.
 * <p>
 * Records from the old archive only contribute meta, their payload is already archived. Other
 * records go to the sink of their data format. The work directory layout is
 * {@code meta/}, {@code skip/}, {@code epub/}, {@code html/} and {@code json/}, one file per key.
 */
public class SinkRouter implements RecordSink {

    public static final String META = "meta";
    public static final String SKIP = "skip";

    private final RecordSink metaSink;
    private final RecordSink skipSink;
    private final RecordSink epubSink;
    private final RecordSink htmlSink;
    private final RecordSink jsonSink;

    public SinkRouter(final RecordSink metaSink,
                      final RecordSink skipSink,
                      final RecordSink epubSink,
                      final RecordSink htmlSink,
                      final RecordSink jsonSink) {
        this.metaSink = metaSink;
        this.skipSink = skipSink;
        this.epubSink = epubSink;
        this.htmlSink = htmlSink;
        this.jsonSink = jsonSink;
    }

    /**
     * Creates directory sinks below the work directory.
     */
    public static SinkRouter inWorkDirectory(final Path workDirectory, final boolean overwrite) {
        final Path meta = workDirectory.resolve(META);
        return new SinkRouter(
                DirectorySink.metaOnly(meta, overwrite),
                DirectorySink.metaOnly(workDirectory.resolve(SKIP), overwrite),
                new DirectorySink(meta, workDirectory.resolve(DataFormat.EPUB.extension()), overwrite),
                new DirectorySink(meta, workDirectory.resolve(DataFormat.HTML.extension()), overwrite),
                new DirectorySink(meta, workDirectory.resolve(DataFormat.JSON.extension()), overwrite));
    }

    /**
     * Writes a selected record to the sink matching its tags.
     *
     * @throws ArchiveInvariantException if no sink accepts the tag combination
     */
    @Override
    public void write(final ArchiveRecord record) throws IOException {
        route(record).write(record);
    }

    /**
     * Writes a selected record, replacing output left by an unfinished attempt at its key.
     *
     * @throws ArchiveInvariantException if no sink accepts the tag combination
     */
    @Override
    public void rewrite(final ArchiveRecord record) throws IOException {
        route(record).rewrite(record);
    }

    /**
     * Writes a record that was not selected.
     */
    public void writeSkipped(final ArchiveRecord record) throws IOException {
        skipSink.write(record);
    }

    /**
     * Writes a record that was not selected, replacing output left by an unfinished attempt.
     */
    public void rewriteSkipped(final ArchiveRecord record) throws IOException {
        skipSink.rewrite(record);
    }

    RecordSink route(final ArchiveRecord record) {
        if (record.hasTag(Origin.ARCHIVE)) {
            return metaSink;
        } else if (record.hasTag(DataFormat.HTML)) {
            return htmlSink;
        } else if (record.hasTag(DataFormat.JSON)) {
            return jsonSink;
        } else if (record.hasTag(DataFormat.EPUB)) {
            return epubSink;
        }
        throw new ArchiveInvariantException("Unsupported record tags for key " + record.getKey()
                + ": " + record.getTags());
    }
}
