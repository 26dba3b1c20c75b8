package de.mirkosertic.archivesync.build;

import de.mirkosertic.archivesync.model.ArchiveRecord;
import de.mirkosertic.archivesync.model.RecordNotFoundException;
import de.mirkosertic.archivesync.model.RecordSource;
import de.mirkosertic.archivesync.model.SourceException;
import de.mirkosertic.archivesync.writer.ArchiveExtra;
import de.mirkosertic.archivesync.writer.ArchivePathMapper;
import de.mirkosertic.archivesync.writer.ArchiveWriter;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds a new archive snapshot from upcoming records.
 * <p>
 * Blacklisted records are dropped. Records whose payload is not available from the upcoming
 * source are revived from the previous archive. The snapshot is written to
 * {@code archive-YYYYMMDD.zip} in the output directory, next to its side-channel index
 * {@code archive-YYYYMMDD.json}.
 */
public class BuildTask {

    private static final Logger logger = LoggerFactory.getLogger(BuildTask.class);

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");
    static final String NAME_PREFIX = "archive-";

    private final Path outputDirectory;
    private final Iterable<ArchiveRecord> upcoming;
    private final @Nullable RecordSource previous;
    private final @Nullable Path extrasDirectory;
    private final Blacklist blacklist;
    private final Clock clock;

    public BuildTask(final Path outputDirectory,
                     final Iterable<ArchiveRecord> upcoming,
                     final @Nullable RecordSource previous,
                     final @Nullable Path extrasDirectory,
                     final Blacklist blacklist,
                     final Clock clock) {
        this.outputDirectory = outputDirectory;
        this.upcoming = upcoming;
        this.previous = previous;
        this.extrasDirectory = extrasDirectory;
        this.blacklist = blacklist;
        this.clock = clock;
    }

    /**
     * Path of the snapshot container for today.
     */
    public Path getArchivePath() {
        return outputDirectory.resolve(NAME_PREFIX + LocalDate.now(clock).format(DATE_FORMAT) + ".zip");
    }

    /**
     * Path of the side-channel index for today.
     */
    public Path getIndexPath() {
        return outputDirectory.resolve(NAME_PREFIX + LocalDate.now(clock).format(DATE_FORMAT) + ".json");
    }

    /**
     * Writes the snapshot.
     *
     * @return the path of the written container
     * @throws IOException     if the output directory is missing or writing fails
     * @throws SourceException if a payload can be found neither upcoming nor in the previous archive
     */
    public Path run() throws IOException {
        if (!Files.isDirectory(outputDirectory)) {
            throw new IOException("Output directory does not exist: " + outputDirectory);
        }

        final Path archivePath = getArchivePath();
        final List<ArchiveExtra> extras = readExtras();
        logger.info("Building snapshot {} with {} extras", archivePath, extras.size());

        int written = 0;
        int skipped = 0;
        try (final ArchiveWriter writer = new ArchiveWriter(archivePath, getIndexPath(), extras, new ArchivePathMapper())) {
            for (final ArchiveRecord record : upcoming) {
                if (blacklist.isBlacklisted(record)) {
                    logger.debug("Skipping blacklisted record {}", record.getKey());
                    skipped++;
                    continue;
                }
                writer.write(resolve(record));
                written++;
            }
        }

        logger.info("Built snapshot {} with {} records ({} blacklisted)", archivePath, written, skipped);
        return archivePath;
    }

    /**
     * Returns the record with its payload, reviving it from the previous archive when needed.
     */
    ArchiveRecord resolve(final ArchiveRecord record) {
        try {
            record.getData();
            return record;
        } catch (final RecordNotFoundException e) {
            return revive(record);
        }
    }

    private ArchiveRecord revive(final ArchiveRecord record) {
        if (previous == null) {
            throw new SourceException("Missing previous archive to revive record " + record.getKey());
        }
        try {
            final byte[] data = previous.fetch(record.getKey(), false, true).getData();
            logger.debug("Revived payload of record {} from the previous archive", record.getKey());
            return record.withData(data);
        } catch (final RecordNotFoundException e) {
            throw new SourceException("Missing revived record " + record.getKey(), e);
        }
    }

    private List<ArchiveExtra> readExtras() throws IOException {
        if (extrasDirectory == null) {
            return List.of();
        }

        final List<Path> files;
        try (final Stream<Path> stream = Files.list(extrasDirectory)) {
            files = stream.filter(Files::isRegularFile)
                    .sorted()
                    .collect(Collectors.toList());
        }

        final List<ArchiveExtra> extras = new ArrayList<>(files.size());
        for (final Path file : files) {
            extras.add(new ArchiveExtra(file.getFileName().toString(), Files.readAllBytes(file)));
        }
        return extras;
    }
}
