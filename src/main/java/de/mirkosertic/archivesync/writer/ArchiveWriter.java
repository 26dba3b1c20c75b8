package de.mirkosertic.archivesync.writer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.archivesync.index.ArchiveIndex;
import de.mirkosertic.archivesync.model.ArchiveInvariantException;
import de.mirkosertic.archivesync.model.ArchiveRecord;
import de.mirkosertic.archivesync.model.DataFormat;
import de.mirkosertic.archivesync.util.JsonSupport;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Streams a new archive snapshot.
 * <p>
 * Every written record adds one line to a side-channel index file and one payload entry to the
 * zip container, so the snapshot is never held in memory. Closing the writer finishes the index,
 * appends the extras and the index itself as {@value ArchiveIndex#INDEX_ENTRY}, and closes the
 * container. Payloads are stored uncompressed, the index and extras are deflated.
 * <p>
 * A writer never replaces existing files and writes every key and every path at most once.
 */
public class ArchiveWriter implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveWriter.class);

    public static final String CONTAINER_EXTENSION = ".zip";

    private final Path archivePath;
    private final Path indexPath;
    private final List<ArchiveExtra> extras;
    private final ArchivePathMapper pathMapper;

    private final ZipOutputStream archive;
    private final BufferedWriter index;

    private final Set<Long> writtenKeys = new HashSet<>();
    private final Set<String> writtenPaths = new HashSet<>();
    private boolean closed;

    public ArchiveWriter(final Path archivePath, final Path indexPath) throws IOException {
        this(archivePath, indexPath, List.of(), new ArchivePathMapper());
    }

    /**
     * Opens the container and the index for writing.
     *
     * @param archivePath target container, must end with {@value #CONTAINER_EXTENSION} and not exist
     * @param indexPath   side-channel index file, must not exist
     * @param extras      files appended to the container on close
     * @param pathMapper  derives payload paths for records that have none
     * @throws ArchiveInvariantException if a target exists or the container extension is wrong
     */
    public ArchiveWriter(final Path archivePath,
                         final Path indexPath,
                         final List<ArchiveExtra> extras,
                         final ArchivePathMapper pathMapper) throws IOException {
        final String fileName = archivePath.getFileName() != null ? archivePath.getFileName().toString() : "";
        if (!fileName.endsWith(CONTAINER_EXTENSION)) {
            throw new ArchiveInvariantException("Archive path must end with " + CONTAINER_EXTENSION + ": " + archivePath);
        }
        if (Files.exists(archivePath)) {
            throw new ArchiveInvariantException("Would overwrite archive: " + archivePath);
        }
        if (Files.exists(indexPath)) {
            throw new ArchiveInvariantException("Would overwrite index: " + indexPath);
        }
        if (archivePath.toAbsolutePath().normalize().equals(indexPath.toAbsolutePath().normalize())) {
            throw new ArchiveInvariantException("Archive and index must be different files: " + archivePath);
        }

        this.archivePath = archivePath;
        this.indexPath = indexPath;
        this.extras = new ArrayList<>(extras);
        this.pathMapper = pathMapper;

        final OutputStream archiveStream = Files.newOutputStream(archivePath, StandardOpenOption.CREATE_NEW);
        this.archive = new ZipOutputStream(new BufferedOutputStream(archiveStream, 1 << 16));
        try {
            this.index = Files.newBufferedWriter(indexPath, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
            index.write("{\n");
        } catch (final IOException e) {
            archive.close();
            throw e;
        }

        logger.info("Opened archive writer for {} (index: {})", archivePath, indexPath);
    }

    public Path getArchivePath() {
        return archivePath;
    }

    public Path getIndexPath() {
        return indexPath;
    }

    public int getWrittenCount() {
        return writtenKeys.size();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Appends a record to the snapshot.
     *
     * @throws ArchiveInvariantException if the writer is closed, the meta id does not match the key,
     *                                   or the key or path was already written
     */
    public void write(final ArchiveRecord record) throws IOException {
        if (closed) {
            throw new ArchiveInvariantException("Writer is closed.");
        }

        final long key = record.getKey();
        final ObjectNode meta = record.getMeta().deepCopy();
        final Long id = JsonSupport.idOf(meta);
        if (id == null || id != key) {
            throw new ArchiveInvariantException("Record key " + key + " does not match meta id " + id);
        }
        if (writtenKeys.contains(key)) {
            throw new ArchiveInvariantException("Record " + key + " was already written");
        }

        final byte[] data = record.getData();

        final JsonNode existing = meta.get("archive");
        final ObjectNode archiveMeta = existing instanceof ObjectNode
                ? (ObjectNode) existing
                : meta.putObject("archive");

        final DataFormat format = record.getTag(DataFormat.class).orElse(DataFormat.EPUB);
        if (!archiveMeta.hasNonNull("format")) {
            archiveMeta.put("format", format.extension());
        }
        if (!archiveMeta.hasNonNull("path")) {
            archiveMeta.put("path", pathMapper.map(key, meta, format));
        }

        final String path = archiveMeta.get("path").asText();
        if (writtenPaths.contains(path) || isReserved(path)) {
            throw new ArchiveInvariantException("Path " + path + " of record " + key + " is already taken");
        }

        final String line = JsonSupport.toSortedLine(meta);

        // Payload first, the index never names an entry the container lacks
        writeStored(path, data);
        writtenPaths.add(path);

        if (!writtenKeys.isEmpty()) {
            index.write(",\n");
        }
        index.write('"');
        index.write(Long.toString(key));
        index.write("\": ");
        index.write(line);
        writtenKeys.add(key);
        logger.debug("Wrote record {} to {}", key, path);
    }

    private boolean isReserved(final String path) {
        if (ArchiveIndex.INDEX_ENTRY.equals(path)) {
            return true;
        }
        for (final ArchiveExtra extra : extras) {
            if (extra.name().equals(path)) {
                return true;
            }
        }
        return false;
    }

    private void writeStored(final String name, final byte[] data) throws IOException {
        final CRC32 crc = new CRC32();
        crc.update(data);

        final ZipEntry entry = new ZipEntry(name);
        entry.setMethod(ZipEntry.STORED);
        entry.setSize(data.length);
        entry.setCompressedSize(data.length);
        entry.setCrc(crc.getValue());

        archive.putNextEntry(entry);
        archive.write(data);
        archive.closeEntry();
    }

    private void writeDeflated(final String name, final byte @Nullable [] data, final @Nullable Path source)
            throws IOException {
        final ZipEntry entry = new ZipEntry(name);
        entry.setMethod(ZipEntry.DEFLATED);
        archive.putNextEntry(entry);
        if (data != null) {
            archive.write(data);
        } else if (source != null) {
            Files.copy(source, archive);
        }
        archive.closeEntry();
    }

    /**
     * Finishes the snapshot. Closing twice is a no-op.
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;

        try (final ZipOutputStream container = archive) {
            try (final BufferedWriter out = index) {
                out.write(writtenKeys.isEmpty() ? "}\n" : "\n}\n");
            }

            final Set<String> extraNames = new HashSet<>();
            for (final ArchiveExtra extra : extras) {
                if (!extraNames.add(extra.name()) || ArchiveIndex.INDEX_ENTRY.equals(extra.name())) {
                    throw new ArchiveInvariantException("Duplicate archive entry for extra " + extra.name());
                }
                writeDeflated(extra.name(), extra.contents(), null);
            }

            writeDeflated(ArchiveIndex.INDEX_ENTRY, null, indexPath);
            container.finish();
        }

        logger.info("Closed archive writer for {} with {} records and {} extras",
                archivePath, writtenKeys.size(), extras.size());
    }
}
