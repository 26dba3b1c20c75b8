package de.mirkosertic.archivesync.select;

import com.fasterxml.jackson.databind.JsonNode;
import de.mirkosertic.archivesync.model.ArchiveRecord;
import de.mirkosertic.archivesync.model.RecordNotFoundException;
import de.mirkosertic.archivesync.model.SourceException;
import de.mirkosertic.archivesync.model.UpdateStatus;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;

/**
 * Selects the upcoming record if the archived one needs to be updated.
 * <p>
 * Both records are first reduced to "present" or "absent": records without chapters and records
 * whose source no longer knows them count as absent. Data of the upcoming record is only
 * fetched once it is known to be newer than the archived one.
 * <table>
 *   <caption>Outcomes</caption>
 *   <tr><th>old</th><th>upcoming</th><th>result</th></tr>
 *   <tr><td>absent</td><td>present</td><td>upcoming, CREATED</td></tr>
 *   <tr><td>present</td><td>present but not newer</td><td>old, REVIVED</td></tr>
 *   <tr><td>present</td><td>present and newer</td><td>upcoming, UPDATED</td></tr>
 *   <tr><td>present</td><td>absent</td><td>old, DELETED</td></tr>
 *   <tr><td>absent</td><td>absent</td><td>nothing</td></tr>
 * </table>
 * The inputs are never modified; the returned record is a tagged copy.
 */
public class UpdateSelector implements Selector {

    private final Function<@Nullable ArchiveRecord, Optional<Instant>> dateMapper;

    public UpdateSelector() {
        this(new LatestModificationMapper());
    }

    public UpdateSelector(final Function<@Nullable ArchiveRecord, Optional<Instant>> dateMapper) {
        this.dateMapper = dateMapper;
    }

    @Override
    public Optional<Selection> select(final @Nullable ArchiveRecord old, final @Nullable ArchiveRecord upcoming) {
        ArchiveRecord current = filterEmpty(old);
        ArchiveRecord candidate = filterEmpty(upcoming);
        boolean deleted = current != null && candidate == null;

        if (current != null) {
            current = filterInvalid(current);
        }

        if (current != null && candidate != null) {
            candidate = filterUnchanged(current, candidate);
        }

        if (candidate != null) {
            candidate = filterInvalid(candidate);
            deleted = current != null && candidate == null;
        }

        if (current == null && candidate != null) {
            return tagged(candidate, UpdateStatus.CREATED);
        } else if (current != null && candidate == null && !deleted) {
            return tagged(current, UpdateStatus.REVIVED);
        } else if (current != null && candidate != null) {
            return tagged(candidate, UpdateStatus.UPDATED);
        } else if (current != null) {
            return tagged(current, UpdateStatus.DELETED);
        }
        return Optional.empty();
    }

    /**
     * Returns the record if it has chapters, otherwise null.
     */
    protected @Nullable ArchiveRecord filterEmpty(final @Nullable ArchiveRecord record) {
        if (record == null) {
            return null;
        }
        final JsonNode chapters;
        try {
            chapters = record.getMeta().get(LatestModificationMapper.CHAPTERS);
        } catch (final RecordNotFoundException e) {
            return null;
        }
        if (chapters == null || !chapters.isContainerNode() || chapters.isEmpty()) {
            return null;
        }
        return record;
    }

    /**
     * Returns the record if both meta and data are available, otherwise null.
     */
    protected @Nullable ArchiveRecord filterInvalid(final ArchiveRecord record) {
        try {
            record.getMeta();
            record.getData();
        } catch (final RecordNotFoundException e) {
            return null;
        }
        return record;
    }

    /**
     * Returns the upcoming record if it is strictly newer than the old one, otherwise null.
     *
     * @throws SourceException if either record has no modification date
     */
    protected @Nullable ArchiveRecord filterUnchanged(final ArchiveRecord old, final ArchiveRecord upcoming) {
        final Instant oldDate = dateMapper.apply(old)
                .orElseThrow(() -> new SourceException("Missing old modification date for key " + old.getKey()));
        final Instant newDate = dateMapper.apply(upcoming)
                .orElseThrow(() -> new SourceException("Missing new modification date for key " + upcoming.getKey()));

        return oldDate.isBefore(newDate) ? upcoming : null;
    }

    private static Optional<Selection> tagged(final ArchiveRecord record, final UpdateStatus status) {
        return Optional.of(new Selection(record.withTag(status), status));
    }
}
