package de.mirkosertic.archivesync.index;

import org.jspecify.annotations.Nullable;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps encoded entries in a hash map.
 */
public class MemoryIndexBackend implements IndexBackend {

    private final Map<Long, byte[]> entries = new HashMap<>();

    @Override
    public void store(final List<IndexEntry> batch) {
        for (final IndexEntry entry : batch) {
            entries.put(entry.key(), entry.encodedMeta());
        }
    }

    @Override
    public byte @Nullable [] load(final long key) {
        return entries.get(key);
    }

    @Override
    public long size() {
        return entries.size();
    }

    @Override
    public void close() {
        entries.clear();
    }
}
