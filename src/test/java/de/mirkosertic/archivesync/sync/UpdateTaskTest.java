package de.mirkosertic.archivesync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.archivesync.ArchiveFixtures;
import de.mirkosertic.archivesync.InMemorySource;
import de.mirkosertic.archivesync.model.ArchiveInvariantException;
import de.mirkosertic.archivesync.model.ArchiveRecord;
import de.mirkosertic.archivesync.model.DataFormat;
import de.mirkosertic.archivesync.model.Origin;
import de.mirkosertic.archivesync.model.RecordSource;
import de.mirkosertic.archivesync.model.SourceException;
import de.mirkosertic.archivesync.model.UpdateStatus;
import de.mirkosertic.archivesync.select.UpdateSelector;
import de.mirkosertic.archivesync.util.JsonSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for UpdateTask: the per-key pipeline and the retry and skip loop.
 */
@DisplayName("UpdateTask Tests")
class UpdateTaskTest {

    private static final Duration SUCCESS_DELAY = Duration.ofSeconds(5);
    private static final Duration SKIPPED_DELAY = Duration.ofSeconds(2);
    private static final Duration FAILURE_DELAY = Duration.ofSeconds(300);
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final String NOW_TEXT = "2024-03-01T12:00:00Z";

    @TempDir
    Path workDir;

    private InMemorySource archive;
    private InMemorySource remote;
    private Sleeper sleeper;
    private UpdateObserver observer;
    private PersistedCursor cursor;

    @BeforeEach
    void setUp() {
        archive = new InMemorySource(Origin.ARCHIVE, DataFormat.EPUB);
        remote = new InMemorySource(Origin.REMOTE, DataFormat.EPUB);
        sleeper = mock(Sleeper.class);
        observer = mock(UpdateObserver.class);
        cursor = PersistedCursor.inDirectory(workDir);
    }

    private UpdateTask task(final RecordSource remoteSource, final int maxRetries, final int maxSkips) {
        return new UpdateTask(
                archive,
                remoteSource,
                new UpdateSelector(),
                new UpdateStamper(Clock.fixed(NOW, ZoneOffset.UTC)),
                SinkRouter.inWorkDirectory(workDir, false),
                cursor,
                new UpdatePolicy(SUCCESS_DELAY, SKIPPED_DELAY, FAILURE_DELAY, maxRetries, maxSkips),
                sleeper,
                observer);
    }

    private JsonNode writtenMeta(final String directory, final long key) throws IOException {
        return JsonSupport.mapper().readTree(workDir.resolve(directory).resolve(Long.toString(key)).toFile());
    }

    @Nested
    @DisplayName("Loop")
    class Loop {

        @Test
        @DisplayName("Should pause per outcome and stop after the skip budget")
        void shouldPausePerOutcome() throws Exception {
            // Given
            remote.put(1, ArchiveFixtures.meta(1, 1, 1), ArchiveFixtures.payload(1));

            // When
            task(remote, 3, 2).run();

            // Then
            final InOrder order = inOrder(sleeper);
            order.verify(sleeper).sleep(SKIPPED_DELAY);
            order.verify(sleeper).sleep(SUCCESS_DELAY);
            order.verify(sleeper, times(2)).sleep(SKIPPED_DELAY);
            order.verifyNoMoreInteractions();
            assertThat(cursor.load()).isEqualTo(4);
        }

        @Test
        @DisplayName("Should resume at the persisted key")
        void shouldResumeAtCursor() throws Exception {
            // Given
            cursor.save(5);

            // When
            task(remote, 3, 1).run();

            // Then
            verify(observer).onAttempt(5, 0, 0);
            verify(observer, never()).onAttempt(eq(4L), anyInt(), anyInt());
            assertThat(cursor.load()).isEqualTo(6);
        }

        @Test
        @DisplayName("Should resume at a key whose output was written before the cursor was saved")
        void shouldResumeAfterInterruptedCycle() throws Exception {
            // Given: key 0 was written, then the process stopped before saving the cursor
            remote.put(0, ArchiveFixtures.meta(0, 1, 1), ArchiveFixtures.payload(0));
            final UpdateTask task = task(remote, 3, 1);
            task.update(0);
            assertThat(cursor.getFile()).doesNotExist();

            // When
            task.run();

            // Then
            verify(observer, never()).onFailure(anyLong(), any());
            verify(observer).onSuccess(eq(0L), any(ArchiveRecord.class), eq(UpdateStatus.CREATED));
            assertThat(cursor.load()).isEqualTo(2);
            assertThat(workDir.resolve("epub/0")).hasBinaryContent(ArchiveFixtures.payload(0));
        }

        @Test
        @DisplayName("Should keep existing output of a key it has not attempted before")
        void shouldKeepOutputOfOtherKeys() throws Exception {
            // Given
            remote.put(1, ArchiveFixtures.meta(1, 1, 1), ArchiveFixtures.payload(1));
            Files.createDirectories(workDir.resolve("meta"));
            Files.writeString(workDir.resolve("meta/1"), "{\"id\": 1}");

            // When
            task(remote, 2, 5).run();

            // Then
            verify(observer, times(2)).onFailure(eq(1L), any(FileAlreadyExistsException.class));
            assertThat(workDir.resolve("meta/1")).hasContent("{\"id\": 1}");
            assertThat(cursor.load()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should retry the same key and stop after the retry budget")
        void shouldRetryAndStop() throws Exception {
            // Given
            final RecordSource failing = mock(RecordSource.class);
            when(failing.fetch(anyLong())).thenThrow(new SourceException("remote down"));

            // When
            task(failing, 3, 10).run();

            // Then
            verify(sleeper, times(3)).sleep(FAILURE_DELAY);
            verify(observer, times(3)).onFailure(eq(0L), any(SourceException.class));
            verify(observer).onAttempt(0, 0, 2);
            assertThat(cursor.getFile()).doesNotExist();
        }

        @Test
        @DisplayName("Should reset the retry counter after a completed key")
        void shouldResetRetriesAfterSuccess() throws Exception {
            // Given
            final RecordSource flaky = mock(RecordSource.class);
            when(flaky.fetch(anyLong()))
                    .thenThrow(new SourceException("hiccup"))
                    .thenThrow(new SourceException("hiccup"))
                    .thenReturn(null);

            // When
            task(flaky, 3, 2).run();

            // Then
            verify(sleeper, times(2)).sleep(FAILURE_DELAY);
            verify(sleeper, times(2)).sleep(SKIPPED_DELAY);
            assertThat(cursor.load()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should stop immediately on an invariant violation")
        void shouldStopOnInvariantViolation() throws Exception {
            // Given
            archive.put(0, ArchiveFixtures.archivedMeta(0, 1, 1), ArchiveFixtures.payload(0));
            remote.put(0, ArchiveFixtures.archivedMeta(0, 2, 1), ArchiveFixtures.payload(0));

            // Then
            assertThatThrownBy(() -> task(remote, 3, 3).run())
                    .isInstanceOf(ArchiveInvariantException.class)
                    .hasMessageContaining("already contains archive meta");
            verify(sleeper, never()).sleep(any());
            assertThat(cursor.getFile()).doesNotExist();
        }

        @Test
        @DisplayName("Should report every outcome to the observer")
        void shouldNotifyObserver() throws Exception {
            remote.put(1, ArchiveFixtures.meta(1, 1, 1), ArchiveFixtures.payload(1));

            task(remote, 3, 2).run();

            verify(observer).onSkipped(0L, null);
            verify(observer).onSuccess(eq(1L), any(ArchiveRecord.class), eq(UpdateStatus.CREATED));
            verify(observer).onSkipped(2L, null);
        }
    }

    @Nested
    @DisplayName("Single key")
    class SingleKey {

        @Test
        @DisplayName("Should stamp and write a created record")
        void shouldStampCreatedRecord() throws Exception {
            // Given
            remote.put(2, ArchiveFixtures.meta(2, 5, 1), ArchiveFixtures.payload(2));

            // When
            final UpdateTask.Outcome outcome = task(remote, 3, 3).update(2);

            // Then
            assertThat(outcome.isSelected()).isTrue();
            assertThat(outcome.selection().status()).isEqualTo(UpdateStatus.CREATED);

            final JsonNode stamps = writtenMeta(SinkRouter.META, 2).get("archive");
            assertThat(stamps.get("date_checked").asText()).isEqualTo(NOW_TEXT);
            assertThat(stamps.get("date_created").asText()).isEqualTo(NOW_TEXT);
            assertThat(stamps.get("date_fetched").asText()).isEqualTo(NOW_TEXT);
            assertThat(stamps.get("date_updated").asText()).isEqualTo(NOW_TEXT);
            assertThat(workDir.resolve("epub/2")).hasBinaryContent(ArchiveFixtures.payload(2));
        }

        @Test
        @DisplayName("Should carry archive meta over to an updated record")
        void shouldCarryArchiveMetaOnUpdate() throws Exception {
            // Given
            final ObjectNode old = ArchiveFixtures.archivedMeta(1, 0, 1);
            ((ObjectNode) old.get("archive")).put("date_created", "2020-01-01T00:00:00Z");
            archive.put(1, old, ArchiveFixtures.payload(1));
            remote.put(1, ArchiveFixtures.meta(1, 1, 1), "new payload".getBytes(StandardCharsets.UTF_8));

            // When
            task(remote, 3, 3).update(1);

            // Then
            final JsonNode stamps = writtenMeta(SinkRouter.META, 1).get("archive");
            assertThat(stamps.get("path").asText()).isEqualTo(ArchiveFixtures.payloadPath(1));
            assertThat(stamps.get("date_created").asText()).isEqualTo("2020-01-01T00:00:00Z");
            assertThat(stamps.get("date_updated").asText()).isEqualTo(NOW_TEXT);
            assertThat(workDir.resolve("epub/1")).hasContent("new payload");
        }

        @Test
        @DisplayName("Should keep upcoming meta but archived payload for a revived record")
        void shouldReviveWithUpcomingMeta() throws Exception {
            // Given
            archive.put(1, ArchiveFixtures.archivedMeta(1, 5, 1), ArchiveFixtures.payload(1));
            final ObjectNode renamed = ArchiveFixtures.meta(1, 5, 1);
            renamed.put("title", "Renamed");
            remote.put(1, renamed, ArchiveFixtures.payload(1));

            // When
            final UpdateTask.Outcome outcome = task(remote, 3, 3).update(1);

            // Then
            assertThat(outcome.selection().status()).isEqualTo(UpdateStatus.REVIVED);
            final JsonNode meta = writtenMeta(SinkRouter.META, 1);
            assertThat(meta.get("title").asText()).isEqualTo("Renamed");
            assertThat(meta.get("archive").get("path").asText()).isEqualTo(ArchiveFixtures.payloadPath(1));
            assertThat(meta.get("archive").get("date_fetched").asText()).isEqualTo(NOW_TEXT);
            assertThat(workDir.resolve("epub/1")).doesNotExist();
            assertThat(remote.dataFetches).hasValue(0);
        }

        @Test
        @DisplayName("Should write the old meta for a deleted record")
        void shouldWriteDeletedMeta() throws Exception {
            archive.put(1, ArchiveFixtures.archivedMeta(1, 5, 1), ArchiveFixtures.payload(1));

            final UpdateTask.Outcome outcome = task(remote, 3, 3).update(1);

            assertThat(outcome.selection().status()).isEqualTo(UpdateStatus.DELETED);
            final JsonNode stamps = writtenMeta(SinkRouter.META, 1).get("archive");
            assertThat(stamps.get("date_checked").asText()).isEqualTo(NOW_TEXT);
            assertThat(stamps.get("date_updated").isNull()).isTrue();
        }

        @Test
        @DisplayName("Should keep empty upcoming records in the skip directory")
        void shouldWriteSkippedRecord() throws Exception {
            remote.put(3, ArchiveFixtures.meta(3, 5, 0), ArchiveFixtures.payload(3));

            final UpdateTask.Outcome outcome = task(remote, 3, 3).update(3);

            assertThat(outcome.isSelected()).isFalse();
            assertThat(outcome.skipped()).isNotNull();
            assertThat(workDir.resolve("skip/3")).exists();
            assertThat(workDir.resolve("meta/3")).doesNotExist();
        }

        @Test
        @DisplayName("Should write nothing for unknown keys")
        void shouldWriteNothingForUnknownKeys() throws Exception {
            final UpdateTask.Outcome outcome = task(remote, 3, 3).update(8);

            assertThat(outcome.isSelected()).isFalse();
            assertThat(outcome.skipped()).isNull();
            assertThat(workDir.resolve("skip")).doesNotExist();
        }
    }

    @Nested
    @DisplayName("Archive meta merge")
    class ArchiveMetaMerge {

        @Test
        @DisplayName("Should leave inputs untouched")
        void shouldLeaveInputsUntouched() {
            archive.put(1, ArchiveFixtures.archivedMeta(1, 0, 1), ArchiveFixtures.payload(1));
            remote.put(1, ArchiveFixtures.meta(1, 1, 1), ArchiveFixtures.payload(1));
            final ArchiveRecord upcoming = remote.fetch(1);

            final ArchiveRecord merged = UpdateTask.copyArchiveMeta(archive.fetch(1), upcoming);

            assertThat(merged).isNotNull();
            assertThat(merged.getMeta().get("archive").get("path").asText()).isEqualTo(ArchiveFixtures.payloadPath(1));
            assertThat(upcoming.getMeta().has("archive")).isFalse();
        }

        @Test
        @DisplayName("Should pass upcoming through when the old record is unknown")
        void shouldPassThroughUnknownOld() {
            remote.put(1, ArchiveFixtures.meta(1, 1, 1), ArchiveFixtures.payload(1));
            final ArchiveRecord upcoming = remote.fetch(1);

            assertThat(UpdateTask.copyArchiveMeta(archive.fetch(1), upcoming)).isSameAs(upcoming);
            assertThat(UpdateTask.copyArchiveMeta(null, upcoming)).isSameAs(upcoming);
        }
    }
}
