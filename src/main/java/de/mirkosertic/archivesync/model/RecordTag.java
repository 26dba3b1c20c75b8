package de.mirkosertic.archivesync.model;

/**
 * Marker for the small closed enumerations used to classify records.
 * <p>
 * Every implementing enum is one tag category. A record holds at most one
 * tag per category, see {@link ArchiveRecord#withTag(RecordTag)}.
 */
public interface RecordTag {

    /**
     * The category this tag belongs to. Two tags conflict when their categories are equal.
     */
    default Class<? extends RecordTag> category() {
        return ((Enum<?>) this).getDeclaringClass().asSubclass(RecordTag.class);
    }
}
