package de.mirkosertic.archivesync.index;

/**
 * One parsed index entry: the record key and its meta in encoded form.
 */
public record IndexEntry(long key, byte[] encodedMeta) {
}
