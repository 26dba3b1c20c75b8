package de.mirkosertic.archivesync.sync;

import de.mirkosertic.archivesync.ArchiveFixtures;
import de.mirkosertic.archivesync.model.ArchiveInvariantException;
import de.mirkosertic.archivesync.model.ArchiveRecord;
import de.mirkosertic.archivesync.model.DataFormat;
import de.mirkosertic.archivesync.model.Origin;
import de.mirkosertic.archivesync.model.RecordTag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@DisplayName("SinkRouter Tests")
class SinkRouterTest {

    private RecordSink meta;
    private RecordSink skip;
    private RecordSink epub;
    private RecordSink html;
    private RecordSink json;
    private SinkRouter router;

    @TempDir
    Path workDir;

    @BeforeEach
    void setUp() {
        meta = mock(RecordSink.class);
        skip = mock(RecordSink.class);
        epub = mock(RecordSink.class);
        html = mock(RecordSink.class);
        json = mock(RecordSink.class);
        router = new SinkRouter(meta, skip, epub, html, json);
    }

    private static ArchiveRecord tagged(final RecordTag... tags) {
        return new ArchiveRecord(1, null, ArchiveFixtures.meta(1, 0, 1), new byte[0], List.of(tags));
    }

    @Test
    @DisplayName("Should send archived records to the meta sink only")
    void shouldRouteArchivedToMeta() throws Exception {
        final ArchiveRecord record = tagged(Origin.ARCHIVE, DataFormat.EPUB);

        router.write(record);

        verify(meta).write(record);
        verifyNoInteractions(epub, html, json, skip);
    }

    @Test
    @DisplayName("Should route other records by data format")
    void shouldRouteByFormat() throws Exception {
        assertThat(router.route(tagged(Origin.REMOTE, DataFormat.HTML))).isSameAs(html);
        assertThat(router.route(tagged(Origin.REMOTE, DataFormat.JSON))).isSameAs(json);
        assertThat(router.route(tagged(Origin.REMOTE, DataFormat.EPUB))).isSameAs(epub);
    }

    @Test
    @DisplayName("Should refuse records without a supported tag")
    void shouldRefuseUnsupportedTags() {
        assertThatThrownBy(() -> router.write(tagged(Origin.REMOTE, DataFormat.FPUB)))
                .isInstanceOf(ArchiveInvariantException.class)
                .hasMessageContaining("Unsupported");
    }

    @Test
    @DisplayName("Should lay out the work directory per format")
    void shouldLayOutWorkDirectory() throws Exception {
        // Given
        final SinkRouter directories = SinkRouter.inWorkDirectory(workDir, false);

        // When
        directories.write(tagged(Origin.REMOTE, DataFormat.HTML));
        directories.writeSkipped(new ArchiveRecord(2, null, ArchiveFixtures.meta(2, 0, 0), new byte[0], List.of()));

        // Then
        assertThat(workDir.resolve("meta/1")).exists();
        assertThat(workDir.resolve("html/1")).exists();
        assertThat(workDir.resolve("epub/1")).doesNotExist();
        assertThat(workDir.resolve("skip/2")).exists();
    }
}
