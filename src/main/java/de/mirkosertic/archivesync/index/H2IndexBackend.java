package de.mirkosertic.archivesync.index;

import de.mirkosertic.archivesync.util.FileTrees;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Stores encoded entries in a single-file embedded H2 database.
 * <p>
 * The database lives in a private directory that is deleted on {@link #close()}.
 */
public class H2IndexBackend implements IndexBackend {

    private static final Logger logger = LoggerFactory.getLogger(H2IndexBackend.class);

    private static final String CREATE_TABLE =
            "CREATE TABLE index_entry (record_key BIGINT PRIMARY KEY, meta VARBINARY NOT NULL)";
    private static final String INSERT = "INSERT INTO index_entry (record_key, meta) VALUES (?, ?)";
    private static final String SELECT = "SELECT meta FROM index_entry WHERE record_key = ?";

    private final Path path;
    private final Connection connection;
    private final PreparedStatement insert;
    private final PreparedStatement select;
    private long size;

    public H2IndexBackend(final Path parent) throws IOException {
        Files.createDirectories(parent);
        this.path = Files.createTempDirectory(parent, "archive-index-h2-");
        final String url = "jdbc:h2:file:" + path.resolve("index").toAbsolutePath();

        try {
            this.connection = DriverManager.getConnection(url, "sa", "");
            try (final Statement statement = connection.createStatement()) {
                statement.execute(CREATE_TABLE);
            }
            connection.setAutoCommit(false);
            this.insert = connection.prepareStatement(INSERT);
            this.select = connection.prepareStatement(SELECT);
        } catch (final SQLException e) {
            FileTrees.deleteRecursively(path);
            throw new IOException("Could not create H2 index database at " + path, e);
        }

        logger.debug("H2 index backend created at {}", path);
    }

    Path getPath() {
        return path;
    }

    @Override
    public void store(final List<IndexEntry> entries) throws IOException {
        try {
            for (final IndexEntry entry : entries) {
                insert.setLong(1, entry.key());
                insert.setBytes(2, entry.encodedMeta());
                insert.addBatch();
            }
            insert.executeBatch();
            connection.commit();
            size += entries.size();
        } catch (final SQLException e) {
            throw new IOException("Could not store index entries", e);
        }
    }

    @Override
    public byte @Nullable [] load(final long key) throws IOException {
        try {
            select.setLong(1, key);
            try (final ResultSet resultSet = select.executeQuery()) {
                if (!resultSet.next()) {
                    return null;
                }
                return resultSet.getBytes(1);
            }
        } catch (final SQLException e) {
            throw new IOException("Could not read index entry " + key, e);
        }
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public void close() throws IOException {
        try {
            try (final Statement statement = connection.createStatement()) {
                statement.execute("SHUTDOWN");
            }
            connection.close();
        } catch (final SQLException e) {
            logger.warn("Failed to shut down H2 index database at {}", path, e);
        } finally {
            FileTrees.deleteRecursively(path);
            logger.debug("H2 index backend at {} removed", path);
        }
    }
}
