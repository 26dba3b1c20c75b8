package de.mirkosertic.archivesync.model;

/**
 * A source cannot serve the request: I/O failure, corrupt container, malformed index,
 * schema mismatch or a closed source. Fatal to the current operation.
 */
public class SourceException extends ArchiveException {

    public SourceException(final String message) {
        super(message);
    }

    public SourceException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
