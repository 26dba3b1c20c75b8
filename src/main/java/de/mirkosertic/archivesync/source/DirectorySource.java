package de.mirkosertic.archivesync.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.archivesync.model.ArchiveRecord;
import de.mirkosertic.archivesync.model.RecordNotFoundException;
import de.mirkosertic.archivesync.model.RecordSource;
import de.mirkosertic.archivesync.model.RecordTag;
import de.mirkosertic.archivesync.model.SourceException;
import de.mirkosertic.archivesync.util.JsonSupport;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads records from the file system, one file per key.
 * <p>
 * Meta is read as JSON from {@code <metaDir>/<key>}, data as raw bytes from {@code <dataDir>/<key>}.
 * Nothing is fetched eagerly. Iteration yields records for the keys of both directories in
 * ascending order.
 */
public class DirectorySource implements RecordSource, Iterable<ArchiveRecord> {

    private final ObjectMapper mapper = JsonSupport.mapper();

    private final @Nullable Path metaDirectory;
    private final @Nullable Path dataDirectory;
    private final Set<RecordTag> tags;

    public DirectorySource(final @Nullable Path metaDirectory,
                           final @Nullable Path dataDirectory,
                           final Collection<? extends RecordTag> tags) {
        this.metaDirectory = metaDirectory;
        this.dataDirectory = dataDirectory;
        this.tags = Set.copyOf(tags);
    }

    @Override
    public Set<RecordTag> getTags() {
        return tags;
    }

    /**
     * Lists the keys found in both directories.
     *
     * @throws SourceException if a directory is missing or contains anything but files named by keys
     */
    public TreeSet<Long> listKeys() {
        final TreeSet<Long> keys = new TreeSet<>();
        collectKeys(metaDirectory, keys);
        collectKeys(dataDirectory, keys);
        return keys;
    }

    private static void collectKeys(final @Nullable Path directory, final Set<Long> keys) {
        if (directory == null) {
            return;
        }
        if (!Files.isDirectory(directory)) {
            throw new SourceException("Path is not a directory: " + directory);
        }

        try (final DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (final Path item : stream) {
                // leftovers of interrupted writes
                if (item.getFileName().toString().startsWith(".")) {
                    continue;
                }
                if (!Files.isRegularFile(item)) {
                    throw new SourceException("Path is not a file: " + item);
                }
                final String name = item.getFileName().toString();
                if (name.isEmpty() || !name.chars().allMatch(c -> c >= '0' && c <= '9')) {
                    throw new SourceException("Name is not a key: " + item);
                }
                try {
                    keys.add(Long.parseLong(name));
                } catch (final NumberFormatException e) {
                    throw new SourceException("Name is not a key: " + item, e);
                }
            }
        } catch (final IOException e) {
            throw new SourceException("Unable to list directory " + directory, e);
        }
    }

    public int size() {
        return listKeys().size();
    }

    @Override
    public Iterator<ArchiveRecord> iterator() {
        final Iterator<Long> keys = listKeys().iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return keys.hasNext();
            }

            @Override
            public ArchiveRecord next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return fetch(keys.next());
            }
        };
    }

    @Override
    public ObjectNode fetchMeta(final long key) {
        if (metaDirectory == null) {
            throw new SourceException("Meta directory is undefined.");
        }

        final byte[] raw = readFile(metaDirectory.resolve(Long.toString(key)));
        try {
            final JsonNode node = mapper.readTree(raw);
            if (!(node instanceof ObjectNode)) {
                throw new SourceException("Meta of record " + key + " is not a JSON object");
            }
            return (ObjectNode) node;
        } catch (final IOException e) {
            throw new SourceException("Meta of record " + key + " is not valid JSON", e);
        }
    }

    @Override
    public byte[] fetchData(final long key) {
        if (dataDirectory == null) {
            throw new SourceException("Data directory is undefined.");
        }
        return readFile(dataDirectory.resolve(Long.toString(key)));
    }

    private static byte[] readFile(final Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (final NoSuchFileException e) {
            throw new RecordNotFoundException("File does not exist: " + path, e);
        } catch (final IOException e) {
            throw new SourceException("Unable to read file " + path, e);
        }
    }
}
