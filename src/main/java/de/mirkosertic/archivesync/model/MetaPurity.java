package de.mirkosertic.archivesync.model;

/**
 * Indicates if record meta has been sanitized.
 */
public enum MetaPurity implements RecordTag {
    CLEAN,
    DIRTY
}
