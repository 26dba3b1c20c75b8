package de.mirkosertic.archivesync;

import de.mirkosertic.archivesync.build.BuildTask;
import de.mirkosertic.archivesync.config.ApplicationConfig;
import de.mirkosertic.archivesync.config.BuildInfo;
import de.mirkosertic.archivesync.config.LoggingConfigurator;
import de.mirkosertic.archivesync.index.ArchiveIndex;
import de.mirkosertic.archivesync.model.DataFormat;
import de.mirkosertic.archivesync.model.MetaPurity;
import de.mirkosertic.archivesync.model.Origin;
import de.mirkosertic.archivesync.select.RefetchSelector;
import de.mirkosertic.archivesync.select.Selector;
import de.mirkosertic.archivesync.select.UpdateSelector;
import de.mirkosertic.archivesync.source.DirectorySource;
import de.mirkosertic.archivesync.sync.PersistedCursor;
import de.mirkosertic.archivesync.sync.SinkRouter;
import de.mirkosertic.archivesync.sync.Sleeper;
import de.mirkosertic.archivesync.sync.UpdateStamper;
import de.mirkosertic.archivesync.sync.UpdateStatisticsTracker;
import de.mirkosertic.archivesync.sync.UpdateTask;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Main entry point.
 * <p>
 * {@code update} walks the configured remote mirror and records changes against the previous
 * archive in the work directory. {@code build} turns the work directory into a new snapshot.
 */
public class ArchiveSyncApplication {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveSyncApplication.class);

    static final String COMMAND_UPDATE = "update";
    static final String COMMAND_BUILD = "build";

    private final ApplicationConfig config;

    public ArchiveSyncApplication(final ApplicationConfig config) {
        this.config = config;
    }

    /**
     * Runs the update task until its retry or skip budget is exhausted.
     */
    public void update() throws IOException, InterruptedException {
        final Path archivePath = requirePath(config.getArchivePath(), "archive");
        final Path workDirectory = Path.of(config.getWorkDirectory());
        final Path remoteMeta = requirePath(config.getRemoteMetaDirectory(), "remote meta-directory");
        final Path remoteData = optionalPath(config.getRemoteDataDirectory());
        Files.createDirectories(workDirectory);

        final Selector selector = config.isRefetch() ? new RefetchSelector() : new UpdateSelector();
        final UpdateStatisticsTracker tracker = new UpdateStatisticsTracker();

        try (final ArchiveIndex archive = new ArchiveIndex(archivePath, config.toIndexOptions());
             final DirectorySource remote = new DirectorySource(remoteMeta, remoteData,
                     Set.of(Origin.REMOTE, config.getRemoteDataFormat(), MetaPurity.DIRTY))) {

            final UpdateTask task = new UpdateTask(
                    archive,
                    remote,
                    selector,
                    new UpdateStamper(Clock.systemUTC()),
                    SinkRouter.inWorkDirectory(workDirectory, config.isOverwrite()),
                    PersistedCursor.inDirectory(workDirectory),
                    config.toUpdatePolicy(),
                    Sleeper.system(),
                    tracker
            );

            tracker.startPeriodicLogging(Duration.ofMillis(config.getProgressIntervalMs()));
            try {
                task.run();
            } finally {
                tracker.logSummary();
                tracker.shutdown();
            }
        }
    }

    /**
     * Builds a snapshot from the work directory and the previous archive.
     *
     * @return path of the written snapshot
     */
    public Path build() throws IOException {
        final Path workDirectory = Path.of(config.getWorkDirectory());
        final Path outputDirectory = requirePath(config.getBuildOutputDirectory(), "build output-directory");
        final Path extrasDirectory = optionalPath(config.getBuildExtrasDirectory());
        final Path previousPath = optionalPath(config.getArchivePath());
        final Path metaDirectory = Files.createDirectories(workDirectory.resolve(SinkRouter.META));
        final Path dataDirectory = Files.createDirectories(workDirectory.resolve(DataFormat.EPUB.extension()));
        Files.createDirectories(outputDirectory);

        final DirectorySource upcoming = new DirectorySource(
                metaDirectory,
                dataDirectory,
                Set.of(Origin.DIRECTORY, DataFormat.EPUB, MetaPurity.CLEAN));

        final ArchiveIndex previous = previousPath != null
                ? new ArchiveIndex(previousPath, config.toIndexOptions())
                : null;
        try {
            return new BuildTask(outputDirectory, upcoming, previous, extrasDirectory,
                    config.toBlacklist(), Clock.systemUTC()).run();
        } finally {
            if (previous != null) {
                previous.close();
            }
        }
    }

    private static Path requirePath(final @Nullable String value, final String setting) {
        final Path path = optionalPath(value);
        if (path == null) {
            throw new IllegalStateException("Missing configuration setting: " + setting);
        }
        return path;
    }

    private static @Nullable Path optionalPath(final @Nullable String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Path.of(value.trim());
    }

    public static void main(final String[] args) {
        final String command = args.length > 0 ? args[0].toLowerCase(Locale.ROOT) : COMMAND_UPDATE;
        if (!COMMAND_UPDATE.equals(command) && !COMMAND_BUILD.equals(command)) {
            System.err.println("Usage: archivesync [" + COMMAND_UPDATE + "|" + COMMAND_BUILD + "]");
            System.exit(2);
            return;
        }

        try {
            // Configure logging FIRST, before any other code that might log
            final boolean deployedMode = "deployed".equals(System.getProperty("archivesync.profile"));
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();
            logger.info("{} running {}", BuildInfo.current().describe(), command);

            final ArchiveSyncApplication app = new ArchiveSyncApplication(config);
            if (COMMAND_BUILD.equals(command)) {
                final Path snapshot = app.build();
                logger.info("Snapshot written to {}", snapshot);
            } else {
                app.update();
            }

            logger.info("archivesync {} finished.", command);

        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted, stopping");
            System.exit(130);
        } catch (final Exception e) {
            logger.error("archivesync {} failed", command, e);
            System.err.println("archivesync " + command + " failed: " + e.getMessage());
            System.exit(1);
        }
    }
}
