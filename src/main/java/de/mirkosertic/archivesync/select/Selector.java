package de.mirkosertic.archivesync.select;

import de.mirkosertic.archivesync.model.ArchiveRecord;
import org.jspecify.annotations.Nullable;

import java.util.Optional;

/**
 * Decides how a record evolves between the stored archive and the remote source.
 */
@FunctionalInterface
public interface Selector {

    /**
     * Picks one of the two records.
     *
     * @param old      the currently archived record, or null if there is none
     * @param upcoming the potential replacement, or null if the source has none
     * @return the record to keep tagged with its lifecycle status, or empty if there is nothing to keep
     */
    Optional<Selection> select(@Nullable ArchiveRecord old, @Nullable ArchiveRecord upcoming);
}
