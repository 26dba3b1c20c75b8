package de.mirkosertic.archivesync.model;

/**
 * Indicates if and how a record has changed between two snapshots.
 * Assigned by the selector only.
 */
public enum UpdateStatus implements RecordTag {
    CREATED,
    REVIVED,
    UPDATED,
    DELETED
}
