package de.mirkosertic.archivesync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.archivesync.model.ArchiveRecord;
import de.mirkosertic.archivesync.model.UpdateStatus;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * Adds archive bookkeeping dates to a selected record.
 * <p>
 * {@code date_checked} is always refreshed. The other dates are only set for the lifecycle
 * statuses that imply them: CREATED sets created, fetched and updated; UPDATED sets fetched and
 * updated; REVIVED sets fetched; DELETED sets nothing else.
 */
public class UpdateStamper {

    public static final String ARCHIVE = "archive";
    public static final String DATE_CHECKED = "date_checked";
    public static final String DATE_CREATED = "date_created";
    public static final String DATE_FETCHED = "date_fetched";
    public static final String DATE_UPDATED = "date_updated";

    private static final List<String> DATE_FIELDS = List.of(DATE_CHECKED, DATE_CREATED, DATE_FETCHED, DATE_UPDATED);

    private final Clock clock;

    public UpdateStamper() {
        this(Clock.systemUTC());
    }

    public UpdateStamper(final Clock clock) {
        this.clock = clock;
    }

    /**
     * Returns a copy of the record with stamped meta. The status is read from the record tags.
     */
    public ArchiveRecord stamp(final ArchiveRecord record) {
        final ObjectNode meta = record.getMeta().deepCopy();

        final JsonNode existing = meta.get(ARCHIVE);
        final ObjectNode archive = existing instanceof ObjectNode
                ? (ObjectNode) existing
                : meta.putObject(ARCHIVE);

        for (final String field : DATE_FIELDS) {
            if (!archive.has(field)) {
                archive.putNull(field);
            }
        }

        final String now = OffsetDateTime.now(clock)
                .withOffsetSameInstant(ZoneOffset.UTC)
                .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        archive.put(DATE_CHECKED, now);

        final Optional<UpdateStatus> status = record.getTag(UpdateStatus.class);
        if (status.isPresent()) {
            switch (status.get()) {
                case CREATED:
                    archive.put(DATE_CREATED, now);
                    archive.put(DATE_FETCHED, now);
                    archive.put(DATE_UPDATED, now);
                    break;
                case UPDATED:
                    archive.put(DATE_FETCHED, now);
                    archive.put(DATE_UPDATED, now);
                    break;
                case REVIVED:
                    archive.put(DATE_FETCHED, now);
                    break;
                case DELETED:
                default:
                    break;
            }
        }

        return record.withMeta(meta);
    }
}
