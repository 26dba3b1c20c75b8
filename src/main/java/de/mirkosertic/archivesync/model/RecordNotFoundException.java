package de.mirkosertic.archivesync.model;

/**
 * The requested key does not exist at a source.
 * <p>
 * Expected during iteration and diffing; callers usually map it to an absent record.
 */
public class RecordNotFoundException extends ArchiveException {

    public RecordNotFoundException(final String message) {
        super(message);
    }

    public RecordNotFoundException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
