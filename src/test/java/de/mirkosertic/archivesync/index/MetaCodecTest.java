package de.mirkosertic.archivesync.index;

import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.archivesync.ArchiveFixtures;
import de.mirkosertic.archivesync.model.SourceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MetaCodec Tests")
class MetaCodecTest {

    @Test
    @DisplayName("Should return a fresh tree on every decode")
    void shouldReturnFreshTree() throws Exception {
        // Given
        final MetaCodec codec = new MetaCodec(true);
        final byte[] encoded = codec.encode(ArchiveFixtures.meta(4, 10, 3));

        // When
        final ObjectNode first = codec.decode(4, encoded);
        first.put("title", "changed");
        final ObjectNode second = codec.decode(4, encoded);

        // Then
        assertThat(second.get("title").asText()).isEqualTo("Story 4");
    }

    @Test
    @DisplayName("Should shrink repetitive meta when compressing")
    void shouldShrinkWhenCompressing() throws Exception {
        final ObjectNode meta = ArchiveFixtures.meta(1, 10, 200);

        assertThat(new MetaCodec(true).encode(meta).length)
                .isLessThan(new MetaCodec(false).encode(meta).length);
    }

    @Test
    @DisplayName("Should reject corrupt bytes")
    void shouldRejectCorruptBytes() {
        final byte[] garbage = "not deflated".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> new MetaCodec(true).decode(9, garbage))
                .isInstanceOf(SourceException.class)
                .hasMessageContaining("key 9");
    }

    @Test
    @DisplayName("Should reject stored values that are not objects")
    void shouldRejectNonObjects() {
        final byte[] array = "[1]".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> new MetaCodec(false).decode(2, array))
                .isInstanceOf(SourceException.class)
                .hasMessageContaining("not an object");
    }
}
