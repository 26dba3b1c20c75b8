package de.mirkosertic.archivesync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.archivesync.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Durable progress marker holding the next key to process.
 * <p>
 * Stored as {@code {"key": n}}. Saving writes a temporary sibling file first and moves it over
 * the cursor file, so a crash never leaves a truncated cursor behind.
 */
public class PersistedCursor {

    private static final Logger logger = LoggerFactory.getLogger(PersistedCursor.class);

    public static final String FILE_NAME = "state.json";
    static final String KEY_FIELD = "key";

    private final ObjectMapper mapper = JsonSupport.mapper();
    private final Path file;

    public PersistedCursor(final Path file) {
        this.file = file;
    }

    /**
     * Creates a cursor stored as {@value #FILE_NAME} in the given directory.
     */
    public static PersistedCursor inDirectory(final Path directory) {
        return new PersistedCursor(directory.resolve(FILE_NAME));
    }

    public Path getFile() {
        return file;
    }

    /**
     * Reads the stored key, or 0 if the cursor has never been saved.
     *
     * @throws IOException if the file exists but cannot be read or holds no valid key
     */
    public long load() throws IOException {
        if (!Files.exists(file)) {
            logger.debug("No cursor at {}, starting at key 0", file);
            return 0;
        }

        final JsonNode root = mapper.readTree(file.toFile());
        final JsonNode key = root != null ? root.get(KEY_FIELD) : null;
        if (key == null || !key.canConvertToLong() || !key.isIntegralNumber() || key.asLong() < 0) {
            throw new IOException("Cursor file " + file + " does not hold a valid key");
        }
        return key.asLong();
    }

    /**
     * Replaces the stored key.
     */
    public void save(final long key) throws IOException {
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        final ObjectNode root = JsonSupport.newObject();
        root.put(KEY_FIELD, key);

        final Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.write(tmp, mapper.writeValueAsBytes(root));
        try {
            Files.move(tmp, file, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (final AtomicMoveNotSupportedException e) {
            logger.warn("Atomic move not supported for {}, falling back to plain replace", file);
            Files.move(tmp, file, REPLACE_EXISTING);
        }
    }
}
