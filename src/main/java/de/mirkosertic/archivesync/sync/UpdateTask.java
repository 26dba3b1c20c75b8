package de.mirkosertic.archivesync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.archivesync.model.ArchiveInvariantException;
import de.mirkosertic.archivesync.model.ArchiveRecord;
import de.mirkosertic.archivesync.model.RecordNotFoundException;
import de.mirkosertic.archivesync.model.RecordSource;
import de.mirkosertic.archivesync.model.UpdateStatus;
import de.mirkosertic.archivesync.select.Selection;
import de.mirkosertic.archivesync.select.Selector;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.util.Optional;

/**
 * Walks the key space and brings the archive up to date with the remote source.
 * <p>
 * Each cycle fetches the archived and the remote record for the cursor key, lets the
 * {@link Selector} decide what to keep, stamps and writes the result, then advances and saves
 * the cursor. Keys are processed strictly one after another, which bounds the request rate to
 * the remote source and makes the cursor a crash-consistent checkpoint.
 * <p>
 * The key a run resumes at, and a key retried after its write failed part way, may already have
 * output from an unfinished attempt. Those keys replace their own earlier output. Other keys
 * refuse to overwrite existing files unless the sinks allow it.
 * <p>
 * A failing cycle leaves the cursor where it is and is retried after the failure delay. The
 * task stops once {@link UpdatePolicy#maxRetries()} cycles failed in a row or
 * {@link UpdatePolicy#maxSkips()} keys in a row yielded nothing. Invariant violations are never
 * retried and end the run immediately.
 */
public class UpdateTask {

    private static final Logger logger = LoggerFactory.getLogger(UpdateTask.class);

    private final RecordSource archive;
    private final RecordSource remote;
    private final Selector selector;
    private final UpdateStamper stamper;
    private final SinkRouter sinks;
    private final PersistedCursor cursor;
    private final UpdatePolicy policy;
    private final Sleeper sleeper;
    private final UpdateObserver observer;

    // key whose output may be on disk even though its cycle has not completed
    private long writingKey = -1;

    public UpdateTask(final RecordSource archive,
                      final RecordSource remote,
                      final Selector selector,
                      final UpdateStamper stamper,
                      final SinkRouter sinks,
                      final PersistedCursor cursor,
                      final UpdatePolicy policy,
                      final Sleeper sleeper,
                      final UpdateObserver observer) {
        this.archive = archive;
        this.remote = remote;
        this.selector = selector;
        this.stamper = stamper;
        this.sinks = sinks;
        this.cursor = cursor;
        this.policy = policy;
        this.sleeper = sleeper;
        this.observer = observer;
    }

    /**
     * Result of processing a single key.
     *
     * @param selection the selected and written record, or null if nothing was selected
     * @param skipped   the record handed to the skip sink, or null
     */
    public record Outcome(@Nullable Selection selection, @Nullable ArchiveRecord skipped) {

        public boolean isSelected() {
            return selection != null;
        }
    }

    /**
     * Runs until the retry or skip budget is exhausted.
     *
     * @throws IOException                if the cursor cannot be loaded
     * @throws InterruptedException       if the thread is interrupted while pausing
     * @throws ArchiveInvariantException  if a cycle violates an archive invariant
     */
    public void run() throws IOException, InterruptedException {
        long key = cursor.load();
        long replaceableKey = key;
        int retried = 0;
        int skipped = 0;

        logger.info("Update task started at key {} (max retries: {}, max skips: {})",
                key, policy.maxRetries(), policy.maxSkips());

        while (skipped < policy.maxSkips() && retried < policy.maxRetries()) {
            observer.onAttempt(key, skipped, retried);

            final Outcome outcome;
            try {
                outcome = update(key, key == replaceableKey);
                cursor.save(key + 1);
            } catch (final ArchiveInvariantException e) {
                logger.error("Invariant violated at key {}, stopping update task", key, e);
                throw e;
            } catch (final IOException | RuntimeException e) {
                if (writingKey == key && !(e instanceof FileAlreadyExistsException)) {
                    replaceableKey = key;
                }
                retried++;
                observer.onFailure(key, e);
                sleeper.sleep(policy.failureDelay());
                continue;
            }

            retried = 0;
            final long processed = key;
            key++;

            final Selection selection = outcome.selection();
            if (selection != null) {
                skipped = 0;
                observer.onSuccess(processed, selection.record(), selection.status());
                sleeper.sleep(policy.successDelay());
            } else {
                skipped++;
                observer.onSkipped(processed, outcome.skipped());
                sleeper.sleep(policy.skippedDelay());
            }
        }

        if (retried >= policy.maxRetries()) {
            logger.warn("Update task stopped at key {} after {} consecutive failures", key, retried);
        } else {
            logger.info("Update task stopped at key {} after {} consecutive skips", key, skipped);
        }
    }

    /**
     * Processes a single key without touching the cursor.
     *
     * @throws IOException               if writing the result fails
     * @throws ArchiveInvariantException if the remote source leaks archive meta or the tags are unsupported
     */
    public Outcome update(final long key) throws IOException {
        return update(key, false);
    }

    private Outcome update(final long key, final boolean replace) throws IOException {
        writingKey = -1;
        final ArchiveRecord old = fetch(archive, key);
        final ArchiveRecord upcoming = copyArchiveMeta(old, fetch(remote, key));

        final Optional<Selection> selected = selector.select(old, upcoming);
        if (selected.isPresent()) {
            final UpdateStatus status = selected.get().status();
            ArchiveRecord record = selected.get().record();
            if (status == UpdateStatus.REVIVED && upcoming != null) {
                record = record.withMeta(upcoming.getMeta());
            }

            record = stamper.stamp(record);
            writingKey = key;
            if (replace) {
                sinks.rewrite(record);
            } else {
                sinks.write(record);
            }
            return new Outcome(new Selection(record, status), null);
        }

        final ArchiveRecord skippedRecord = upcoming != null && hasMeta(upcoming) ? upcoming
                : old != null && hasMeta(old) ? old
                : null;
        if (skippedRecord != null) {
            writingKey = key;
            if (replace) {
                sinks.rewriteSkipped(skippedRecord);
            } else {
                sinks.writeSkipped(skippedRecord);
            }
        }
        return new Outcome(null, skippedRecord);
    }

    private static @Nullable ArchiveRecord fetch(final RecordSource source, final long key) {
        try {
            return source.fetch(key);
        } catch (final RecordNotFoundException e) {
            return null;
        }
    }

    private static boolean hasMeta(final ArchiveRecord record) {
        try {
            record.getMeta();
            return true;
        } catch (final RecordNotFoundException e) {
            return false;
        }
    }

    /**
     * Carries the archive bookkeeping of the old record over to the upcoming one.
     *
     * @throws ArchiveInvariantException if the upcoming record already carries archive meta
     */
    static @Nullable ArchiveRecord copyArchiveMeta(final @Nullable ArchiveRecord old,
                                                   final @Nullable ArchiveRecord upcoming) {
        if (old == null || upcoming == null) {
            return upcoming;
        }

        final ObjectNode upcomingMeta;
        final JsonNode archiveMeta;
        try {
            upcomingMeta = upcoming.getMeta();
            if (upcomingMeta.has(UpdateStamper.ARCHIVE)) {
                throw new ArchiveInvariantException(
                        "Upcoming record " + upcoming.getKey() + " already contains archive meta");
            }
            archiveMeta = old.getMeta().get(UpdateStamper.ARCHIVE);
        } catch (final RecordNotFoundException e) {
            return upcoming;
        }

        if (archiveMeta == null) {
            return upcoming;
        }

        final ObjectNode merged = upcomingMeta.deepCopy();
        merged.set(UpdateStamper.ARCHIVE, archiveMeta.deepCopy());
        return upcoming.withMeta(merged);
    }
}
