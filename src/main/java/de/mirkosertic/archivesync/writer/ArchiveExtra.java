package de.mirkosertic.archivesync.writer;

/**
 * An out-of-band file appended to a snapshot, such as a readme.
 *
 * @param name     entry name inside the container
 * @param contents file contents
 */
public record ArchiveExtra(String name, byte[] contents) {

    public ArchiveExtra {
        if (name.isBlank()) {
            throw new IllegalArgumentException("Extra name must not be blank");
        }
    }
}
