package de.mirkosertic.archivesync.model;

import java.util.Locale;

/**
 * Indicates the file format of a record's payload.
 */
public enum DataFormat implements RecordTag {
    EPUB("epub"),
    FPUB("fpub"),
    HTML("html"),
    JSON("json");

    private final String extension;

    DataFormat(final String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * Resolves a format from its configuration name, e.g. {@code "epub"}.
     *
     * @throws IllegalArgumentException if the name matches no format
     */
    public static DataFormat fromName(final String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
