package de.mirkosertic.archivesync.source;

import de.mirkosertic.archivesync.ArchiveFixtures;
import de.mirkosertic.archivesync.model.ArchiveRecord;
import de.mirkosertic.archivesync.model.DataFormat;
import de.mirkosertic.archivesync.model.Origin;
import de.mirkosertic.archivesync.model.RecordNotFoundException;
import de.mirkosertic.archivesync.model.SourceException;
import de.mirkosertic.archivesync.util.JsonSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for DirectorySource.
 */
@DisplayName("DirectorySource Tests")
class DirectorySourceTest {

    @TempDir
    Path tempDir;

    private Path metaDir;
    private Path dataDir;
    private DirectorySource source;

    @BeforeEach
    void setUp() throws IOException {
        metaDir = Files.createDirectories(tempDir.resolve("meta"));
        dataDir = Files.createDirectories(tempDir.resolve("data"));
        source = new DirectorySource(metaDir, dataDir, Set.of(Origin.DIRECTORY, DataFormat.EPUB));
    }

    private void writeMeta(final long key) throws IOException {
        Files.write(metaDir.resolve(Long.toString(key)),
                JsonSupport.toSortedPrettyBytes(ArchiveFixtures.meta(key, 0, 1)));
    }

    private void writeData(final long key) throws IOException {
        Files.write(dataDir.resolve(Long.toString(key)), ArchiveFixtures.payload(key));
    }

    @Test
    @DisplayName("Should list the union of keys in ascending order")
    void shouldListKeys() throws IOException {
        // Given
        writeMeta(10);
        writeMeta(2);
        writeData(2);
        writeData(7);

        // When
        final List<Long> keys = new ArrayList<>();
        for (final ArchiveRecord record : source) {
            keys.add(record.getKey());
        }

        // Then
        assertThat(keys).containsExactly(2L, 7L, 10L);
        assertThat(source.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should read meta and data lazily")
    void shouldReadLazily() throws IOException {
        writeMeta(2);
        writeData(2);

        final ArchiveRecord record = source.fetch(2);

        assertThat(record.hasMeta()).isFalse();
        assertThat(record.getMeta().get("title").asText()).isEqualTo("Story 2");
        assertThat(record.getData()).isEqualTo(ArchiveFixtures.payload(2));
        assertThat(record.getTags()).containsExactlyInAnyOrder(Origin.DIRECTORY, DataFormat.EPUB);
    }

    @Test
    @DisplayName("Should report missing files as not found")
    void shouldReportMissingFiles() throws IOException {
        writeMeta(2);

        assertThatThrownBy(() -> source.fetchData(2)).isInstanceOf(RecordNotFoundException.class);
        assertThatThrownBy(() -> source.fetchMeta(3)).isInstanceOf(RecordNotFoundException.class);
    }

    @Test
    @DisplayName("Should ignore hidden files left by interrupted writes")
    void shouldIgnoreHiddenFiles() throws IOException {
        // Given
        writeMeta(3);
        Files.writeString(metaDir.resolve(".4.tmp"), "{");

        // Then
        assertThat(source.listKeys()).containsExactly(3L);
    }

    @Test
    @DisplayName("Should refuse files not named by a key")
    void shouldRefuseForeignFiles() throws IOException {
        Files.writeString(metaDir.resolve("notes.txt"), "x");

        assertThatThrownBy(source::listKeys)
                .isInstanceOf(SourceException.class)
                .hasMessageContaining("not a key");
    }

    @Test
    @DisplayName("Should refuse meta that is not a JSON object")
    void shouldRefuseInvalidMeta() throws IOException {
        Files.writeString(metaDir.resolve("4"), "[1, 2]");
        Files.writeString(metaDir.resolve("5"), "{broken");

        assertThatThrownBy(() -> source.fetchMeta(4))
                .isInstanceOf(SourceException.class)
                .hasMessageContaining("not a JSON object");
        assertThatThrownBy(() -> source.fetchMeta(5))
                .isInstanceOf(SourceException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    @DisplayName("Should refuse meta lookups without a meta directory")
    void shouldRefuseUndefinedDirectory() {
        final DirectorySource dataOnly = new DirectorySource(null, dataDir, Set.of());

        assertThatThrownBy(() -> dataOnly.fetchMeta(1))
                .isInstanceOf(SourceException.class)
                .hasMessageContaining("undefined");
    }
}
