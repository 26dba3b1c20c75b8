package de.mirkosertic.archivesync.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.archivesync.ArchiveFixtures;
import de.mirkosertic.archivesync.InMemorySource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ArchiveRecord Tests")
class ArchiveRecordTest {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Should reject a lazy record without source")
        void shouldRejectLazyRecordWithoutSource() {
            assertThatThrownBy(() -> new ArchiveRecord(1, null, ArchiveFixtures.meta(1, 0, 1), null, List.of()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("source");
        }

        @Test
        @DisplayName("Should accept a complete record without source")
        void shouldAcceptCompleteRecordWithoutSource() {
            final ArchiveRecord record = new ArchiveRecord(1, null, ArchiveFixtures.meta(1, 0, 1), new byte[]{1}, List.of());

            assertThat(record.isFetched()).isTrue();
            assertThat(record.getSource()).isNull();
        }

        @Test
        @DisplayName("Should reject negative keys")
        void shouldRejectNegativeKeys() {
            assertThatThrownBy(() -> new ArchiveRecord(-1, new InMemorySource(), null, null, List.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should reject two tags of the same category")
        void shouldRejectConflictingTags() {
            assertThatThrownBy(() -> new ArchiveRecord(1, new InMemorySource(), null, null,
                    List.of(DataFormat.EPUB, DataFormat.HTML)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("DataFormat");
        }
    }

    @Nested
    @DisplayName("Lazy population")
    class LazyPopulation {

        @Test
        @DisplayName("Should fetch meta and data at most once")
        void shouldFetchOnce() {
            // Given
            final InMemorySource source = new InMemorySource()
                    .put(3, ArchiveFixtures.meta(3, 10, 2), ArchiveFixtures.payload(3));
            final ArchiveRecord record = new ArchiveRecord(3, source, null, null, List.of());

            // When
            record.getMeta();
            record.getMeta();
            record.getData();
            record.getData();

            // Then
            assertThat(source.metaFetches).hasValue(1);
            assertThat(source.dataFetches).hasValue(1);
            assertThat(record.isFetched()).isTrue();
        }

        @Test
        @DisplayName("Should report missing fields without asking the source")
        void shouldReportMissingFields() {
            final InMemorySource source = new InMemorySource();
            final ArchiveRecord record = new ArchiveRecord(3, source, null, null, List.of());

            assertThat(record.hasMeta()).isFalse();
            assertThat(record.hasData()).isFalse();
            assertThat(source.metaFetches).hasValue(0);
        }

        @Test
        @DisplayName("Should propagate not-found from the source")
        void shouldPropagateNotFound() {
            final ArchiveRecord record = new ArchiveRecord(3, new InMemorySource(), null, null, List.of());

            assertThatThrownBy(record::getMeta).isInstanceOf(RecordNotFoundException.class);
            assertThat(record.hasMeta()).isFalse();
        }
    }

    @Nested
    @DisplayName("Copies")
    class Copies {

        @Test
        @DisplayName("Should replace meta on the copy only")
        void shouldReplaceMetaOnCopy() {
            final ObjectNode original = ArchiveFixtures.meta(1, 0, 1);
            final ObjectNode replacement = ArchiveFixtures.meta(1, 5, 1);
            final ArchiveRecord record = new ArchiveRecord(1, null, original, new byte[]{7}, List.of(Origin.REMOTE));

            final ArchiveRecord copy = record.withMeta(replacement);

            assertThat(copy.getMeta()).isSameAs(replacement);
            assertThat(copy.getData()).containsExactly(7);
            assertThat(copy.getTags()).containsExactly(Origin.REMOTE);
            assertThat(record.getMeta()).isSameAs(original);
        }

        @Test
        @DisplayName("Should replace a tag of the same category")
        void shouldReplaceTagOfSameCategory() {
            final ArchiveRecord record = new ArchiveRecord(1, new InMemorySource(), null, null,
                    List.of(Origin.ARCHIVE, UpdateStatus.CREATED));

            final ArchiveRecord copy = record.withTag(UpdateStatus.DELETED);

            assertThat(copy.getTag(UpdateStatus.class)).contains(UpdateStatus.DELETED);
            assertThat(copy.hasTag(Origin.ARCHIVE)).isTrue();
            assertThat(record.getTag(UpdateStatus.class)).contains(UpdateStatus.CREATED);
        }

        @Test
        @DisplayName("Should not share the tag set with the caller")
        void shouldKeepPrivateTagCopy() {
            final ArchiveRecord record = new ArchiveRecord(1, new InMemorySource(), null, null, List.of(Origin.REMOTE));

            assertThatThrownBy(() -> record.getTags().add(DataFormat.EPUB))
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThat(record.getTag(DataFormat.class)).isEmpty();
        }
    }
}
