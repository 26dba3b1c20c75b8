package de.mirkosertic.archivesync.build;

import com.fasterxml.jackson.databind.JsonNode;
import de.mirkosertic.archivesync.model.ArchiveRecord;

import java.util.Collection;
import java.util.Set;

/**
 * Authors and records that opted out of the archive.
 */
public record Blacklist(Set<Long> authorIds, Set<Long> recordIds) {

    public Blacklist {
        authorIds = Set.copyOf(authorIds);
        recordIds = Set.copyOf(recordIds);
    }

    public static Blacklist empty() {
        return new Blacklist(Set.of(), Set.of());
    }

    public static Blacklist of(final Collection<Long> authorIds, final Collection<Long> recordIds) {
        return new Blacklist(Set.copyOf(authorIds), Set.copyOf(recordIds));
    }

    /**
     * True if the record itself or its author is listed. Reads the record meta when authors are listed.
     */
    public boolean isBlacklisted(final ArchiveRecord record) {
        if (recordIds.contains(record.getKey())) {
            return true;
        }
        if (authorIds.isEmpty()) {
            return false;
        }
        final JsonNode authorId = record.getMeta().path("author").get("id");
        return authorId != null && authorId.canConvertToLong() && authorIds.contains(authorId.asLong());
    }
}
