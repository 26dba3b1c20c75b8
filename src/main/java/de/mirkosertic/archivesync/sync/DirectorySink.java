package de.mirkosertic.archivesync.sync;

import de.mirkosertic.archivesync.model.ArchiveRecord;
import de.mirkosertic.archivesync.util.JsonSupport;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes records as one file per key: meta as indented, key-sorted JSON to
 * {@code <metaDir>/<key>} and data as raw bytes to {@code <dataDir>/<key>}.
 * <p>
 * Either directory may be omitted. Existing files are only replaced when overwriting is enabled
 * or when the record is rewritten. Every file is written to a hidden temporary sibling first and
 * then moved into place, so a target is either absent or complete.
 */
public class DirectorySink implements RecordSink {

    private static final Logger logger = LoggerFactory.getLogger(DirectorySink.class);

    private final @Nullable Path metaDirectory;
    private final @Nullable Path dataDirectory;
    private final boolean overwrite;

    public DirectorySink(final @Nullable Path metaDirectory,
                         final @Nullable Path dataDirectory,
                         final boolean overwrite) {
        this.metaDirectory = metaDirectory;
        this.dataDirectory = dataDirectory;
        this.overwrite = overwrite;
    }

    public static DirectorySink metaOnly(final Path metaDirectory, final boolean overwrite) {
        return new DirectorySink(metaDirectory, null, overwrite);
    }

    public @Nullable Path getMetaDirectory() {
        return metaDirectory;
    }

    public @Nullable Path getDataDirectory() {
        return dataDirectory;
    }

    /**
     * Writes meta and data of the record.
     *
     * @throws FileAlreadyExistsException if a target exists and overwriting is disabled
     */
    @Override
    public void write(final ArchiveRecord record) throws IOException {
        write(record, overwrite);
    }

    /**
     * Writes meta and data of the record, replacing existing files for its key.
     */
    @Override
    public void rewrite(final ArchiveRecord record) throws IOException {
        write(record, true);
    }

    private void write(final ArchiveRecord record, final boolean replace) throws IOException {
        final Path metaPath = metaDirectory != null ? metaDirectory.resolve(Long.toString(record.getKey())) : null;
        final Path dataPath = dataDirectory != null ? dataDirectory.resolve(Long.toString(record.getKey())) : null;

        // Check both targets before writing either
        if (!replace) {
            if (metaPath != null) {
                checkOverwrite(metaPath);
            }
            if (dataPath != null) {
                checkOverwrite(dataPath);
            }
        }

        // Data first, so a meta file never points at missing data
        if (dataPath != null) {
            writeAtomically(dataPath, record.getData());
        }
        if (metaPath != null) {
            writeAtomically(metaPath, JsonSupport.toSortedPrettyBytes(record.getMeta()));
        }
        logger.debug("Wrote record {} to {} / {}", record.getKey(), metaPath, dataPath);
    }

    private static void checkOverwrite(final Path path) throws FileAlreadyExistsException {
        if (Files.exists(path)) {
            throw new FileAlreadyExistsException(path.toString(), null, "Would overwrite");
        }
    }

    private static void writeAtomically(final Path path, final byte[] contents) throws IOException {
        final Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        final Path temp = path.resolveSibling("." + path.getFileName() + ".tmp");
        Files.write(temp, contents);
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (final IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }
}
