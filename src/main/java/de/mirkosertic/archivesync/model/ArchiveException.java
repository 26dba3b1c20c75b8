package de.mirkosertic.archivesync.model;

/**
 * Base class of all archive related failures.
 */
public class ArchiveException extends RuntimeException {

    public ArchiveException(final String message) {
        super(message);
    }

    public ArchiveException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
