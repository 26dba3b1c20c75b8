package de.mirkosertic.archivesync.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A single archived unit of content: key, metadata, payload and classification tags.
 * <p>
 * Records are immutable by convention. Meta and data may be populated lazily from the
 * {@link RecordSource} the record was created by; each accessor asks the source at most
 * once and caches the answer. Modifications never happen in place, the {@code with*}
 * methods return copies that share the source and every field that was not overridden.
 * <p>
 * A record must either carry a source or both meta and data.
 */
public final class ArchiveRecord {

    private final long key;
    private final @Nullable RecordSource source;
    private final Map<Class<? extends RecordTag>, RecordTag> tags;

    private @Nullable ObjectNode meta;
    private byte @Nullable [] data;

    /**
     * Creates a record.
     *
     * @param key    primary key, must not be negative
     * @param source source used for lazy population, may be null if meta and data are given
     * @param meta   metadata, or null to fetch it lazily
     * @param data   payload, or null to fetch it lazily
     * @param tags   classification tags, at most one per category
     * @throws IllegalArgumentException if the record would be lazy without a source, if the key
     *                                  is negative or if two tags share a category
     */
    public ArchiveRecord(final long key,
                         final @Nullable RecordSource source,
                         final @Nullable ObjectNode meta,
                         final byte @Nullable [] data,
                         final Collection<? extends RecordTag> tags) {
        if (key < 0) {
            throw new IllegalArgumentException("Record key must not be negative: " + key);
        }
        if (source == null && (meta == null || data == null)) {
            throw new IllegalArgumentException("Record must contain a source if lazy.");
        }

        this.key = key;
        this.source = source;
        this.meta = meta;
        this.data = data;
        this.tags = collectTags(tags);
    }

    private static Map<Class<? extends RecordTag>, RecordTag> collectTags(
            final Collection<? extends RecordTag> tags) {
        final Map<Class<? extends RecordTag>, RecordTag> result = new LinkedHashMap<>();
        for (final RecordTag tag : tags) {
            final RecordTag previous = result.putIfAbsent(tag.category(), tag);
            if (previous != null && previous != tag) {
                throw new IllegalArgumentException(
                        "Conflicting tags " + previous + " and " + tag + " in category "
                                + tag.category().getSimpleName());
            }
        }
        return result;
    }

    public long getKey() {
        return key;
    }

    public @Nullable RecordSource getSource() {
        return source;
    }

    /**
     * True if no more fetches are necessary.
     */
    public boolean isFetched() {
        return hasMeta() && hasData();
    }

    /**
     * True if meta is present without asking the source.
     */
    public boolean hasMeta() {
        return meta != null;
    }

    /**
     * Returns the record meta, fetching it from the source on first access.
     *
     * @throws RecordNotFoundException if the source does not know this key
     * @throws SourceException         if the source is unusable
     */
    public ObjectNode getMeta() {
        ObjectNode current = meta;
        if (current == null) {
            current = requireSource().fetchMeta(key);
            meta = current;
        }
        return current;
    }

    /**
     * True if data is present without asking the source.
     */
    public boolean hasData() {
        return data != null;
    }

    /**
     * Returns the record data, fetching it from the source on first access.
     *
     * @throws RecordNotFoundException if the source does not know this key
     * @throws SourceException         if the source is unusable
     */
    public byte[] getData() {
        byte[] current = data;
        if (current == null) {
            current = requireSource().fetchData(key);
            data = current;
        }
        return current;
    }

    private RecordSource requireSource() {
        if (source == null) {
            // unreachable through the public constructor
            throw new IllegalStateException("Record " + key + " has no source");
        }
        return source;
    }

    public Set<RecordTag> getTags() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(tags.values()));
    }

    public boolean hasTag(final RecordTag tag) {
        return tags.get(tag.category()) == tag;
    }

    /**
     * Returns the tag this record holds for the given category.
     */
    public <T extends RecordTag> Optional<T> getTag(final Class<T> category) {
        return Optional.ofNullable(tags.get(category)).map(category::cast);
    }

    /**
     * Returns a copy holding the given meta instead of the current one.
     */
    public ArchiveRecord withMeta(final ObjectNode newMeta) {
        return new ArchiveRecord(key, source, newMeta, data, tags.values());
    }

    /**
     * Returns a copy holding the given data instead of the current one.
     */
    public ArchiveRecord withData(final byte[] newData) {
        return new ArchiveRecord(key, source, meta, newData, tags.values());
    }

    /**
     * Returns a copy holding exactly the given tags.
     */
    public ArchiveRecord withTags(final Collection<? extends RecordTag> newTags) {
        return new ArchiveRecord(key, source, meta, data, newTags);
    }

    /**
     * Returns a copy holding the given tag, replacing any tag of the same category.
     */
    public ArchiveRecord withTag(final RecordTag tag) {
        final Map<Class<? extends RecordTag>, RecordTag> copy = new LinkedHashMap<>(tags);
        copy.put(tag.category(), tag);
        return new ArchiveRecord(key, source, meta, data, copy.values());
    }

    @Override
    public String toString() {
        return "ArchiveRecord[key=" + key + ", tags=" + tags.values()
                + ", meta=" + (meta != null ? "present" : "lazy")
                + ", data=" + (data != null ? data.length + " bytes" : "lazy") + "]";
    }
}
