package de.mirkosertic.archivesync.select;

import de.mirkosertic.archivesync.model.ArchiveRecord;
import de.mirkosertic.archivesync.model.UpdateStatus;

/**
 * Outcome of a {@link Selector}: the record to keep, already tagged with its lifecycle status.
 */
public record Selection(ArchiveRecord record, UpdateStatus status) {
}
