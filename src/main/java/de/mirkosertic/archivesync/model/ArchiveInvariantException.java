package de.mirkosertic.archivesync.model;

/**
 * A logic error that retrying cannot fix, such as a mismatched id, a write after close
 * or an attempt to overwrite an existing snapshot.
 */
public class ArchiveInvariantException extends ArchiveException {

    public ArchiveInvariantException(final String message) {
        super(message);
    }

    public ArchiveInvariantException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
