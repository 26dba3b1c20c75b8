package de.mirkosertic.archivesync.sync;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for PersistedCursor.
 */
@DisplayName("PersistedCursor Tests")
class PersistedCursorTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should start at key 0 without a cursor file")
    void shouldStartAtZero() throws IOException {
        assertThat(PersistedCursor.inDirectory(tempDir).load()).isZero();
    }

    @Test
    @DisplayName("Should survive a new instance")
    void shouldPersistKey() throws IOException {
        // Given
        PersistedCursor.inDirectory(tempDir.resolve("work")).save(42);

        // When
        final long key = PersistedCursor.inDirectory(tempDir.resolve("work")).load();

        // Then
        assertThat(key).isEqualTo(42);
        assertThat(tempDir.resolve("work/state.json")).hasContent("{\"key\":42}");
        assertThat(tempDir.resolve("work/state.json.tmp")).doesNotExist();
    }

    @Test
    @DisplayName("Should replace an existing key")
    void shouldReplaceKey() throws IOException {
        final PersistedCursor cursor = PersistedCursor.inDirectory(tempDir);
        cursor.save(1);
        cursor.save(2);

        assertThat(cursor.load()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should refuse a cursor file without a valid key")
    void shouldRefuseInvalidFile() throws IOException {
        Files.writeString(tempDir.resolve(PersistedCursor.FILE_NAME), "{\"key\": \"seven\"}");

        assertThatThrownBy(() -> PersistedCursor.inDirectory(tempDir).load())
                .isInstanceOf(IOException.class)
                .hasMessageContaining("valid key");
    }

    @Test
    @DisplayName("Should refuse a corrupt cursor file")
    void shouldRefuseCorruptFile() throws IOException {
        Files.writeString(tempDir.resolve(PersistedCursor.FILE_NAME), "{\"key\": ");

        assertThatThrownBy(() -> PersistedCursor.inDirectory(tempDir).load())
                .isInstanceOf(IOException.class);
    }
}
