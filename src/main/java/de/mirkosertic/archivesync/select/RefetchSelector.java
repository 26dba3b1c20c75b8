package de.mirkosertic.archivesync.select;

import de.mirkosertic.archivesync.model.ArchiveRecord;

/**
 * Selects the upcoming record whenever it is available, regardless of its modification date.
 */
public class RefetchSelector extends UpdateSelector {

    @Override
    protected ArchiveRecord filterUnchanged(final ArchiveRecord old, final ArchiveRecord upcoming) {
        return upcoming;
    }
}
