package de.mirkosertic.archivesync.model;

/**
 * Indicates the general structure of record meta.
 */
public enum MetaFormat implements RecordTag {
    ALPHA,
    BETA
}
