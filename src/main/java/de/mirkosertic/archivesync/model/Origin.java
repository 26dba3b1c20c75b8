package de.mirkosertic.archivesync.model;

/**
 * Indicates from where a record was fetched.
 */
public enum Origin implements RecordTag {
    REMOTE,
    ARCHIVE,
    DIRECTORY
}
