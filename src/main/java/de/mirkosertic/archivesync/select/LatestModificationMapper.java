package de.mirkosertic.archivesync.select;

import com.fasterxml.jackson.databind.JsonNode;
import de.mirkosertic.archivesync.model.ArchiveRecord;
import de.mirkosertic.archivesync.model.RecordNotFoundException;
import de.mirkosertic.archivesync.util.JsonSupport;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;

/**
 * Maps a record to the latest modification date found in its meta.
 * <p>
 * Both the top-level {@code date_modified} and the {@code date_modified} of every chapter are
 * considered. Dates may be epoch seconds or ISO-8601 strings.
 */
public class LatestModificationMapper implements Function<@Nullable ArchiveRecord, Optional<Instant>> {

    static final String DATE_MODIFIED = "date_modified";
    static final String CHAPTERS = "chapters";

    /**
     * @return the latest date, or empty if the record is absent, unknown to its source or undated
     */
    @Override
    public Optional<Instant> apply(final @Nullable ArchiveRecord record) {
        if (record == null) {
            return Optional.empty();
        }

        final JsonNode meta;
        try {
            meta = record.getMeta();
        } catch (final RecordNotFoundException e) {
            return Optional.empty();
        }

        Instant latest = JsonSupport.toInstant(meta.get(DATE_MODIFIED));

        final JsonNode chapters = meta.get(CHAPTERS);
        if (chapters != null && chapters.isArray()) {
            for (final JsonNode chapter : chapters) {
                final Instant chapterDate = JsonSupport.toInstant(chapter.get(DATE_MODIFIED));
                if (chapterDate != null && (latest == null || chapterDate.isAfter(latest))) {
                    latest = chapterDate;
                }
            }
        }

        return Optional.ofNullable(latest);
    }
}
